package com.codeheadsystems.revoker.model.outcome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Successful completion of the removal workflow.
 * <p>
 * {@code removed} is true exactly when {@code assignmentId} is non-null: either the assignment
 * was found and deleted, or there was nothing to delete.  Use {@link #removed} and
 * {@link #alreadyAbsent} rather than the canonical constructor.
 *
 * @param username        the Salesforce username that was looked up
 * @param userId          the resolved {@code User.Id}
 * @param permissionSetId the permission set the user was removed from
 * @param assignmentId    the deleted {@code PermissionSetAssignment.Id}, or null if none existed
 * @param removed         whether a delete was issued
 * @param address         the normalized Salesforce base URL used
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"status", "username", "userId", "permissionSetId", "assignmentId", "removed", "address"})
public record RemovalResult(
    @JsonProperty("username") String username,
    @JsonProperty("userId") String userId,
    @JsonProperty("permissionSetId") String permissionSetId,
    @JsonProperty("assignmentId") String assignmentId,
    @JsonProperty("removed") boolean removed,
    @JsonProperty("address") String address) implements RemovalOutcome {

  /**
   * The status value for this outcome.
   */
  public static final String STATUS = "success";

  /**
   * Enforces that {@code removed} and {@code assignmentId} agree.
   */
  public RemovalResult {
    if (removed != (assignmentId != null)) {
      throw new IllegalArgumentException(
          "removed=" + removed + " is inconsistent with assignmentId=" + assignmentId);
    }
  }

  /**
   * The assignment existed and was deleted.
   *
   * @param username        the username
   * @param userId          the user id
   * @param permissionSetId the permission set id
   * @param assignmentId    the deleted assignment id
   * @param address         the address
   * @return the removal result
   */
  public static RemovalResult removed(String username, String userId, String permissionSetId,
                                      String assignmentId, String address) {
    return new RemovalResult(username, userId, permissionSetId, assignmentId, true, address);
  }

  /**
   * The user was not assigned the permission set; nothing was deleted.
   *
   * @param username        the username
   * @param userId          the user id
   * @param permissionSetId the permission set id
   * @param address         the address
   * @return the removal result
   */
  public static RemovalResult alreadyAbsent(String username, String userId, String permissionSetId,
                                            String address) {
    return new RemovalResult(username, userId, permissionSetId, null, false, address);
  }

  @Override
  @JsonProperty("status")
  public String status() {
    return STATUS;
  }
}
