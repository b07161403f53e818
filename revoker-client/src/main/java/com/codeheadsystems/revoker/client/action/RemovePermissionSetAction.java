package com.codeheadsystems.revoker.client.action;

import com.codeheadsystems.revoker.client.accessor.OAuth2TokenAccessor;
import com.codeheadsystems.revoker.client.accessor.SalesforceAccessor;
import com.codeheadsystems.revoker.client.auth.CredentialResolver;
import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.codeheadsystems.revoker.client.config.TargetResolver;
import com.codeheadsystems.revoker.client.manager.HaltSignal;
import com.codeheadsystems.revoker.client.manager.PermissionSetRemovalManager;
import com.codeheadsystems.revoker.client.model.RemovalRequest;
import com.codeheadsystems.revoker.client.recovery.FailureClassifier;
import com.codeheadsystems.revoker.client.recovery.RecoveryHandler;
import com.codeheadsystems.revoker.model.outcome.HaltedResult;
import com.codeheadsystems.revoker.model.outcome.RemovalOutcome;
import com.codeheadsystems.revoker.model.outcome.RetryRequested;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The three entry points a job runtime calls on the permission set removal action.
 * <ul>
 *   <li>{@link #invoke}: run the removal.</li>
 *   <li>{@link #error}: the previous invoke threw; decide between retrying and giving up.</li>
 *   <li>{@link #halt}: the runtime is shutting the job down.</li>
 * </ul>
 */
@Singleton
public class RemovePermissionSetAction {

  private static final Logger log = LoggerFactory.getLogger(RemovePermissionSetAction.class);

  private final PermissionSetRemovalManager manager;
  private final RecoveryHandler recoveryHandler;

  /**
   * Instantiates a new Remove permission set action.
   *
   * @param manager         the manager
   * @param recoveryHandler the recovery handler
   */
  @Inject
  public RemovePermissionSetAction(final PermissionSetRemovalManager manager,
                                   final RecoveryHandler recoveryHandler) {
    log.info("RemovePermissionSetAction()");
    this.manager = manager;
    this.recoveryHandler = recoveryHandler;
  }

  /**
   * Wires the action by hand with its default collaborators.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param clientConfig the client config
   * @param clock        the clock
   * @return the action
   */
  public static RemovePermissionSetAction create(final HttpClient httpClient,
                                                 final ObjectMapper objectMapper,
                                                 final ClientConfig clientConfig,
                                                 final Clock clock) {
    OAuth2TokenAccessor tokenAccessor = new OAuth2TokenAccessor(httpClient, objectMapper, clientConfig);
    SalesforceAccessor salesforceAccessor = new SalesforceAccessor(httpClient, objectMapper, clientConfig);
    PermissionSetRemovalManager manager = new PermissionSetRemovalManager(
        new TargetResolver(), new CredentialResolver(tokenAccessor), salesforceAccessor, clientConfig, clock);
    return new RemovePermissionSetAction(manager, new RecoveryHandler(new FailureClassifier()));
  }

  /**
   * Runs the removal.
   *
   * @param request    the request
   * @param context    the invocation context
   * @param haltSignal polled between remote calls
   * @return the outcome
   */
  public RemovalOutcome invoke(final RemovalRequest request,
                               final RevokerContext context,
                               final HaltSignal haltSignal) {
    return manager.remove(request, context, haltSignal);
  }

  /**
   * Handles a failed invoke.
   *
   * @param error the error thrown by {@link #invoke}
   * @return a retry request, if the error is retryable
   * @throws RuntimeException the original error, if it is fatal
   */
  public RetryRequested error(final RuntimeException error) {
    return recoveryHandler.recover(error);
  }

  /**
   * Handles a graceful shutdown.
   *
   * @param username the username being processed, may be null
   * @param reason   the halt reason
   * @return the halted outcome
   */
  public HaltedResult halt(final String username, final String reason) {
    return manager.halted(username, reason);
  }
}
