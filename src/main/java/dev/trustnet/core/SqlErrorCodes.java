/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.ErrorCode;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.Map;

/**
 * Maps the failures {@link JdbcTrustLineStore} can run into onto storage {@link ErrorCode}s.
 *
 * <p>The store only ever hits a handful of conditions: a duplicate pair or line id on insert, a
 * racing seed of a {@code trustnet_globals} row, a deadlock between two units of work locking
 * lines, a {@code FOR UPDATE} that waited too long, or a lost connection. Each is recognised by
 * JDBC exception subtype first, then by MariaDB or H2 vendor code, then by SQLState class.
 */
public final class SqlErrorCodes {

  // MariaDB vendor codes, plus the codes H2 raises in MariaDB mode.
  private static final Map<Integer, ErrorCode> VENDOR_CODES =
      Map.ofEntries(
          Map.entry(1062, ErrorCode.DUPLICATE_KEY), // ER_DUP_ENTRY
          Map.entry(1586, ErrorCode.DUPLICATE_KEY), // ER_DUP_ENTRY_WITH_KEY_NAME
          Map.entry(23505, ErrorCode.DUPLICATE_KEY), // H2 DUPLICATE_KEY_1
          Map.entry(1213, ErrorCode.DEADLOCK_RETRY_EXHAUSTED), // ER_LOCK_DEADLOCK
          Map.entry(40001, ErrorCode.DEADLOCK_RETRY_EXHAUSTED), // H2 DEADLOCK_1
          Map.entry(1205, ErrorCode.LOCK_TIMEOUT), // ER_LOCK_WAIT_TIMEOUT
          Map.entry(50200, ErrorCode.LOCK_TIMEOUT), // H2 LOCK_TIMEOUT_1
          Map.entry(2002, ErrorCode.CONNECTION_LOST), // CR_CONNECTION_ERROR
          Map.entry(2006, ErrorCode.CONNECTION_LOST), // CR_SERVER_GONE_ERROR
          Map.entry(2013, ErrorCode.CONNECTION_LOST)); // CR_SERVER_LOST

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception.
   *
   * @param e failure raised by the driver or the pool
   * @return storage code; {@link ErrorCode#STORAGE_FAILURE} when nothing matches
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.STORAGE_FAILURE;
    }
    // Integrity violations can only come from the primary keys and the line id index.
    if (e instanceof SQLIntegrityConstraintViolationException) {
      return ErrorCode.DUPLICATE_KEY;
    }
    if (e instanceof SQLTransactionRollbackException) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (e instanceof SQLTimeoutException) {
      return ErrorCode.LOCK_TIMEOUT;
    }
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException) {
      return ErrorCode.CONNECTION_LOST;
    }

    ErrorCode byVendor = VENDOR_CODES.get(e.getErrorCode());
    if (byVendor != null) {
      return byVendor;
    }

    String state = e.getSQLState();
    if (state == null || state.length() < 2) {
      // Pool and proxy wrappers often carry the driver's exception as the cause.
      if (e.getCause() instanceof SQLException sql) {
        return classify(sql);
      }
      return ErrorCode.STORAGE_FAILURE;
    }
    if ("HYT00".equals(state)) {
      return ErrorCode.LOCK_TIMEOUT;
    }
    switch (state.substring(0, 2)) {
      case "23":
        return ErrorCode.DUPLICATE_KEY;
      case "40":
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      case "08":
        return ErrorCode.CONNECTION_LOST;
      default:
        return ErrorCode.STORAGE_FAILURE;
    }
  }

  /**
   * Whether a failed insert collided with an existing key.
   *
   * @param e insert failure
   * @return {@code true} for a duplicate pair, line id or counter row
   */
  static boolean isDuplicateKey(SQLException e) {
    return classify(e) == ErrorCode.DUPLICATE_KEY;
  }
}
