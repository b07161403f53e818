package com.codeheadsystems.revoker.client.manager;

import java.util.Optional;

/**
 * Cooperative cancellation.  The workflow polls this before every remote call and stops,
 * reporting a halted outcome, once a reason is present.  An in-flight call is never aborted.
 */
@FunctionalInterface
public interface HaltSignal {

  /**
   * A signal that never halts.
   */
  HaltSignal NEVER = Optional::empty;

  /**
   * The reason the runtime asked us to stop, if it has.
   *
   * @return the halt reason
   */
  Optional<String> haltReason();
}
