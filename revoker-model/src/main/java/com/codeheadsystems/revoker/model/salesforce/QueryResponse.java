package com.codeheadsystems.revoker.model.salesforce;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Body of a Salesforce REST {@code GET /services/data/{version}/query} response.
 * <p>
 * Only the fields the removal workflow reads are mapped; everything else Salesforce returns
 * ({@code nextRecordsUrl}, per-record {@code attributes}, ...) is ignored.  A missing
 * {@code records} array is treated the same as an empty one.
 * <p>
 * Used by: SOQL lookups for {@code User} and {@code PermissionSetAssignment}
 *
 * @param totalSize the number of records matched by the query
 * @param done      whether all records are contained in this page
 * @param records   the matched records, in the order Salesforce returned them
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryResponse(
    @JsonProperty("totalSize") int totalSize,
    @JsonProperty("done") boolean done,
    @JsonProperty("records") List<QueryRecord> records) {

  /**
   * Normalizes a missing records array to an empty list.
   */
  public QueryResponse {
    records = records == null ? List.of() : List.copyOf(records);
  }

  /**
   * The first record in response order, if any.
   *
   * @return the first record
   */
  public Optional<QueryRecord> firstRecord() {
    return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
  }
}
