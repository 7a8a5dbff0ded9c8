/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import java.util.Map;

/** JMX view of {@link Metrics}. */
public interface TrustnetMetricsMXBean {
  long getMutationSuccess();

  long getMutationFailure();

  long getQuerySuccess();

  long getQueryFailure();

  long getRippleLegsMoved();

  Map<String, Long> getSuccessByOperation();

  Map<String, Long> getFailureByOperation();

  Map<String, Long> getFailureByCode();

  String getLastErrorCode();
}
