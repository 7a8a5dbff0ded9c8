/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.ErrorCode;
import java.sql.SQLException;
import java.util.Objects;

/** Storage backend failure, classified into a storage {@link ErrorCode}. */
public final class StoreException extends RuntimeException {
  private final ErrorCode errorCode;
  private final String op;

  public StoreException(ErrorCode errorCode, String op, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    this.op = op;
  }

  /**
   * Wraps a JDBC failure.
   *
   * @param op logical store operation, used in logs
   * @param e cause
   * @return classified exception
   */
  static StoreException wrap(String op, SQLException e) {
    return new StoreException(SqlErrorCodes.classify(e), op, e.getMessage(), e);
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  public String op() {
    return op;
  }
}
