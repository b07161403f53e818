package com.codeheadsystems.revoker.client.manager;

import com.codeheadsystems.revoker.client.accessor.SalesforceAccessor;
import com.codeheadsystems.revoker.client.auth.CredentialResolver;
import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.codeheadsystems.revoker.client.config.TargetResolver;
import com.codeheadsystems.revoker.client.exceptions.PrincipalNotFoundException;
import com.codeheadsystems.revoker.client.model.LookupResult;
import com.codeheadsystems.revoker.client.model.RemovalRequest;
import com.codeheadsystems.revoker.client.model.SalesforceSession;
import com.codeheadsystems.revoker.model.outcome.HaltedResult;
import com.codeheadsystems.revoker.model.outcome.RemovalOutcome;
import com.codeheadsystems.revoker.model.outcome.RemovalResult;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes a Salesforce user from a permission set, idempotently.
 * <p>
 * The three remote calls depend on each other and run strictly in order:
 * <ol>
 *   <li>Find the user by username.  No match is fatal ({@link PrincipalNotFoundException}).</li>
 *   <li>Find the user's assignment to the permission set.  No match means there is nothing to
 *       remove and the workflow finishes with {@code removed=false}.</li>
 *   <li>Delete the first matching assignment and finish with {@code removed=true}.</li>
 * </ol>
 * Running the workflow again after a successful removal therefore reports
 * {@code removed=false} instead of failing, which makes scheduler-level retries safe.
 * <p>
 * The target address and credentials are resolved before any Salesforce call.  The
 * {@link HaltSignal} is checked before each remote call (including a client credentials token
 * request); once it fires no further calls are made and a {@link HaltedResult} is returned.
 * Failures propagate as the {@code RevokerException} subtype raised where they were detected.
 */
@Singleton
public class PermissionSetRemovalManager {

  private static final Logger log = LoggerFactory.getLogger(PermissionSetRemovalManager.class);

  private final TargetResolver targetResolver;
  private final CredentialResolver credentialResolver;
  private final SalesforceAccessor salesforceAccessor;
  private final ClientConfig clientConfig;
  private final Clock clock;

  /**
   * Instantiates a new Permission set removal manager.
   *
   * @param targetResolver     the target resolver
   * @param credentialResolver the credential resolver
   * @param salesforceAccessor the salesforce accessor
   * @param clientConfig       the client config
   * @param clock              clock used to stamp halted outcomes
   */
  @Inject
  public PermissionSetRemovalManager(final TargetResolver targetResolver,
                                     final CredentialResolver credentialResolver,
                                     final SalesforceAccessor salesforceAccessor,
                                     final ClientConfig clientConfig,
                                     final Clock clock) {
    log.info("PermissionSetRemovalManager()");
    this.targetResolver = targetResolver;
    this.credentialResolver = credentialResolver;
    this.salesforceAccessor = salesforceAccessor;
    this.clientConfig = clientConfig;
    this.clock = clock;
  }

  /**
   * Runs the workflow to completion.
   *
   * @param request the request
   * @param context the invocation context
   * @return the removal result
   */
  public RemovalResult remove(final RemovalRequest request, final RevokerContext context) {
    return (RemovalResult) remove(request, context, HaltSignal.NEVER);
  }

  /**
   * Runs the workflow, stopping early if the halt signal fires.
   *
   * @param request    the request
   * @param context    the invocation context
   * @param haltSignal the halt signal
   * @return a {@link RemovalResult}, or a {@link HaltedResult} if halted
   */
  public RemovalOutcome remove(final RemovalRequest request,
                               final RevokerContext context,
                               final HaltSignal haltSignal) {
    request.validate();
    final String username = request.username();
    final String permissionSetId = request.permissionSetId();
    log.info("Removing user {} from permission set {}", username, permissionSetId);

    final String address = targetResolver.resolve(request.address(), context);

    Optional<HaltedResult> halted = checkHalt(haltSignal, username);
    if (halted.isPresent()) {
      return halted.get();
    }
    final SalesforceSession session = new SalesforceSession(address,
        credentialResolver.resolve(context),
        request.apiVersion() == null || request.apiVersion().isBlank()
            ? clientConfig.apiVersion() : request.apiVersion());

    // Step 1: the user must exist
    halted = checkHalt(haltSignal, username);
    if (halted.isPresent()) {
      return halted.get();
    }
    LookupResult user = salesforceAccessor.findUserByUsername(session, username);
    final String userId = user.firstId().orElseThrow(() -> new PrincipalNotFoundException(username));
    log.debug("Found user id {}", userId);

    // Step 2: no assignment means the user is already out of the permission set
    halted = checkHalt(haltSignal, username);
    if (halted.isPresent()) {
      return halted.get();
    }
    LookupResult assignment = salesforceAccessor.findPermissionSetAssignment(session, userId, permissionSetId);
    if (assignment.isEmpty()) {
      log.info("No assignment of permission set {} for user {}, nothing to remove", permissionSetId, userId);
      return RemovalResult.alreadyAbsent(username, userId, permissionSetId, address);
    }
    final String assignmentId = assignment.firstId().get();

    // Step 3: delete it
    halted = checkHalt(haltSignal, username);
    if (halted.isPresent()) {
      return halted.get();
    }
    salesforceAccessor.deletePermissionSetAssignment(session, assignmentId);
    log.info("Removed user {} from permission set {} (assignment {})", userId, permissionSetId, assignmentId);
    return RemovalResult.removed(username, userId, permissionSetId, assignmentId, address);
  }

  /**
   * Builds the halted outcome the runtime reports on graceful shutdown.
   *
   * @param username the username, may be null
   * @param reason   the reason
   * @return the halted result
   */
  public HaltedResult halted(final String username, final String reason) {
    log.info("Permission set removal halted ({}) for user {}", reason, username);
    return new HaltedResult(username, reason, clock.instant().toString());
  }

  private Optional<HaltedResult> checkHalt(final HaltSignal haltSignal, final String username) {
    return haltSignal.haltReason().map(reason -> halted(username, reason));
  }
}
