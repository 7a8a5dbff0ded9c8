/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operation counters exposed via JMX.
 *
 * <p>Counts successes and failures per catalog {@link Operation} and per {@link ErrorCode}, and
 * keeps the last failure code for quick diagnostics.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final String MBEAN_NAME = "dev.trustnet:type=TrustnetMetrics";

  private final Map<Operation, AtomicLong> success = counters(Operation.class);
  private final Map<Operation, AtomicLong> failure = counters(Operation.class);
  private final Map<ErrorCode, AtomicLong> failureByCode = counters(ErrorCode.class);
  private final AtomicLong rippleLegs = new AtomicLong();
  private final AtomicReference<String> lastErrorCode = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;

  /** Creates and registers the metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  /**
   * Records the outcome of one catalog operation.
   *
   * @param op operation
   * @param ok whether it succeeded
   * @param code failure code ({@code null} on success)
   */
  public void recordOperation(Operation op, boolean ok, ErrorCode code) {
    if (op == null) {
      return;
    }
    (ok ? success : failure).get(op).incrementAndGet();
    if (!ok && code != null) {
      failureByCode.get(code).incrementAndGet();
      lastErrorCode.set(code.name());
    }
  }

  /**
   * Records the legs of a committed rippled payment.
   *
   * @param legs number of trust lines the payment moved
   */
  public void recordRippleLegs(int legs) {
    rippleLegs.addAndGet(legs);
  }

  long successCount(Operation op) {
    return success.get(op).get();
  }

  long failureCount(Operation op) {
    return failure.get(op).get();
  }

  private static <E extends Enum<E>> Map<E, AtomicLong> counters(Class<E> type) {
    Map<E, AtomicLong> map = new EnumMap<>(type);
    for (E e : type.getEnumConstants()) {
      map.put(e, new AtomicLong());
    }
    return map;
  }

  private long total(boolean mutating, Map<Operation, AtomicLong> counters) {
    long sum = 0;
    for (Map.Entry<Operation, AtomicLong> e : counters.entrySet()) {
      if (e.getKey().mutating() == mutating) {
        sum += e.getValue().get();
      }
    }
    return sum;
  }

  private static <E extends Enum<E>> Map<String, Long> snapshot(Map<E, AtomicLong> counters) {
    Map<String, Long> out = new LinkedHashMap<>();
    counters.forEach((k, v) -> out.put(k.toString(), v.get()));
    return out;
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(new Bean(), objectName);
    } catch (Exception e) {
      LOG.warn("(trustnet) metrics registration failed", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(trustnet) metrics unregister failed", e);
    }
  }

  private final class Bean implements TrustnetMetricsMXBean {
    @Override
    public long getMutationSuccess() {
      return total(true, success);
    }

    @Override
    public long getMutationFailure() {
      return total(true, failure);
    }

    @Override
    public long getQuerySuccess() {
      return total(false, success);
    }

    @Override
    public long getQueryFailure() {
      return total(false, failure);
    }

    @Override
    public long getRippleLegsMoved() {
      return rippleLegs.get();
    }

    @Override
    public Map<String, Long> getSuccessByOperation() {
      return snapshot(success);
    }

    @Override
    public Map<String, Long> getFailureByOperation() {
      return snapshot(failure);
    }

    @Override
    public Map<String, Long> getFailureByCode() {
      return snapshot(failureByCode);
    }

    @Override
    public String getLastErrorCode() {
      return lastErrorCode.get();
    }
  }
}
