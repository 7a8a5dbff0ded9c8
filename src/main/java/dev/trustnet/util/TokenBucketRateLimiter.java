/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.util;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket limiter with one bucket per key.
 *
 * <p>Used to throttle repetitive log lines (for example the same rejection code on the same
 * operation). A bucket holds at most {@code capacity} tokens and regains {@code refillPerSec}
 * tokens per second. Buckets that sit full and unused for longer than the idle TTL are dropped
 * so the key space stays bounded.
 *
 * @param <K> bucket key type
 */
public final class TokenBucketRateLimiter<K> {
  private static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(5);
  private static final double FULL_EPSILON = 1e-9;

  private final Map<K, Bucket> buckets = new ConcurrentHashMap<>();
  private final double capacity;
  private final double refillPerNano;
  private final long idleTtlNanos;
  private final LongSupplier clock;
  private final AtomicLong nextSweepNanos;

  /**
   * Creates a limiter with the default idle TTL.
   *
   * @param capacity bucket size (at least {@code 1})
   * @param refillPerSec tokens regained per second (fractional allowed)
   */
  public TokenBucketRateLimiter(int capacity, double refillPerSec) {
    this(capacity, refillPerSec, DEFAULT_IDLE_TTL, System::nanoTime);
  }

  TokenBucketRateLimiter(int capacity, double refillPerSec, Duration idleTtl, LongSupplier clock) {
    Objects.requireNonNull(idleTtl, "idleTtl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.capacity = Math.max(1, capacity);
    this.refillPerNano = Math.max(0.0001, refillPerSec) / 1_000_000_000.0d;
    this.idleTtlNanos = Math.max(0L, idleTtl.toNanos());
    long now = clock.getAsLong();
    this.nextSweepNanos = new AtomicLong(idleTtlNanos == 0 ? Long.MAX_VALUE : now + idleTtlNanos);
  }

  /**
   * Consumes one token from {@code key}'s bucket if available.
   *
   * @param key bucket identity
   * @return {@code true} if a token was consumed
   */
  public boolean tryAcquire(K key) {
    long now = clock.getAsLong();
    sweepIdle(now);
    Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(capacity, now));
    synchronized (bucket) {
      bucket.refill(now);
      if (bucket.tokens < 1.0) {
        return false;
      }
      bucket.tokens -= 1.0;
      bucket.lastUsedNanos = now;
      return true;
    }
  }

  int bucketCount() {
    return buckets.size();
  }

  private void sweepIdle(long now) {
    long next = nextSweepNanos.get();
    if (now < next || !nextSweepNanos.compareAndSet(next, now + idleTtlNanos)) {
      return;
    }
    buckets
        .values()
        .removeIf(
            bucket -> {
              synchronized (bucket) {
                bucket.refill(now);
                return bucket.tokens >= capacity - FULL_EPSILON
                    && now - bucket.lastUsedNanos >= idleTtlNanos;
              }
            });
  }

  private final class Bucket {
    double tokens;
    long lastRefillNanos;
    long lastUsedNanos;

    Bucket(double tokens, long now) {
      this.tokens = tokens;
      this.lastRefillNanos = now;
      this.lastUsedNanos = now;
    }

    void refill(long now) {
      long elapsed = now - lastRefillNanos;
      if (elapsed > 0L) {
        tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
        lastRefillNanos = now;
      }
    }
  }
}
