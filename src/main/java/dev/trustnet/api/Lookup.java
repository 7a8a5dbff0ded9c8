/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.Objects;

/**
 * Outcome of a read-only query.
 *
 * @param value result on success ({@code null} on failure)
 * @param code error code explaining a failure ({@code null} on success)
 * @param message optional human-readable message
 * @param <T> value type
 */
public record Lookup<T>(T value, ErrorCode code, String message) {
  public Lookup {
    if (value == null && code == null) {
      throw new IllegalArgumentException("lookups require a value or an error code");
    }
  }

  public static <T> Lookup<T> found(T value) {
    return new Lookup<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> Lookup<T> failure(ErrorCode code, String message) {
    return new Lookup<>(null, Objects.requireNonNull(code, "code"), message);
  }

  /**
   * Whether the query produced a value.
   *
   * @return {@code true} on success
   */
  public boolean ok() {
    return code == null;
  }
}
