/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a rippled payment.
 *
 * @param result commit outcome
 * @param legs legs moved, in path order (empty on failure)
 */
public record RippleResult(OperationResult result, List<Leg> legs) {
  public RippleResult {
    Objects.requireNonNull(result, "result");
    legs = legs == null ? List.of() : List.copyOf(legs);
  }

  public static RippleResult success(List<Leg> legs) {
    return new RippleResult(OperationResult.success(), legs);
  }

  public static RippleResult failure(ErrorCode code, String message) {
    return new RippleResult(OperationResult.failure(code, message), List.of());
  }

  public boolean ok() {
    return result.ok();
  }

  public ErrorCode code() {
    return result.code();
  }

  /**
   * Amount that reached the final recipient.
   *
   * @return last leg's amount, or {@code 0} on failure
   */
  public long delivered() {
    return legs.isEmpty() ? 0L : legs.get(legs.size() - 1).amount();
  }

  /**
   * One trust line traversed by the payment.
   *
   * @param from participant paying on this line
   * @param to participant paid on this line
   * @param amount amount moved after decay
   */
  public record Leg(AccountId from, AccountId to, long amount) {}
}
