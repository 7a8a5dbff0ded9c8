/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.Objects;

/**
 * Outcome of a trust line mutation.
 *
 * @param ok whether the operation committed
 * @param code error code explaining a failure ({@code null} on success)
 * @param message optional human-readable message
 */
public record OperationResult(boolean ok, ErrorCode code, String message) {
  /**
   * Canonical constructor enforcing invariant checks.
   *
   * @param ok whether the operation committed
   * @param code error code (required on failure)
   * @param message optional human-readable message
   */
  public OperationResult {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
  }

  /**
   * Creates a success result without additional context.
   *
   * @return success outcome
   */
  public static OperationResult success() {
    return new OperationResult(true, null, null);
  }

  /**
   * Failure with a canonical {@link ErrorCode}.
   *
   * @param code canonical error code
   * @param message optional human-readable message (may be {@code null})
   * @return failure outcome with {@link #ok()} {@code false}
   */
  public static OperationResult failure(ErrorCode code, String message) {
    return new OperationResult(false, Objects.requireNonNull(code, "code"), message);
  }
}
