/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.TrustLines;
import dev.trustnet.api.events.TrustLineEvents;

/**
 * Service locator for the running engine.
 *
 * <p>Created once at boot by {@link CoreServices#start(Config)}. Call {@link #shutdown()} on
 * process stop to release the store, the event pool and the connection pool.
 */
public interface Services {

  /**
   * Trust line operations.
   *
   * @return the trust line service singleton
   */
  TrustLines trustLines();

  /**
   * Committed-change notifications.
   *
   * @return the event bus facade singleton
   */
  TrustLineEvents events();

  /**
   * Administrator identity captured at boot.
   *
   * @return immutable governance settings
   */
  Governance governance();

  /**
   * Operation counters, also exported over JMX.
   *
   * @return metrics registry
   */
  Metrics metrics();

  /**
   * Stops background work and closes storage. Accessors are unusable afterwards.
   */
  void shutdown();
}
