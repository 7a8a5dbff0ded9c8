/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MariaDB-backed {@link TrustLineStore}.
 *
 * <p>Each unit of work runs on one connection with auto-commit disabled. Lines are read with
 * {@code SELECT ... FOR UPDATE}; callers that touch several pairs lock them in canonical order.
 * The SQL sticks to the subset MariaDB shares with H2's MariaDB mode.
 */
public final class JdbcTrustLineStore implements TrustLineStore {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");

  private static final String COLUMNS =
      "account_lo, account_hi, line_id, asset_id, limit_lo, limit_hi, balance, quality_in,"
          + " quality_out, allow_rippling, created_at_s, updated_at_s";

  private static final String[] SCHEMA = {
    """
    CREATE TABLE IF NOT EXISTS trust_lines (
      account_lo      BINARY(32)  NOT NULL,
      account_hi      BINARY(32)  NOT NULL,
      line_id         BIGINT      NOT NULL,
      asset_id        BIGINT      NOT NULL,
      limit_lo        BIGINT      NOT NULL,
      limit_hi        BIGINT      NOT NULL,
      balance         BIGINT      NOT NULL,
      quality_in      BIGINT      NOT NULL,
      quality_out     BIGINT      NOT NULL,
      allow_rippling  BOOLEAN     NOT NULL,
      created_at_s    BIGINT      NOT NULL,
      updated_at_s    BIGINT      NOT NULL,
      PRIMARY KEY (account_lo, account_hi)
    )
    """,
    "CREATE UNIQUE INDEX IF NOT EXISTS idx_trust_lines_id ON trust_lines (line_id)",
    "CREATE INDEX IF NOT EXISTS idx_trust_lines_hi ON trust_lines (account_hi)",
    """
    CREATE TABLE IF NOT EXISTS trustnet_globals (
      field_name   VARCHAR(32) NOT NULL,
      field_value  BIGINT      NOT NULL,
      PRIMARY KEY (field_name)
    )
    """
  };

  private final DataSource ds;

  /**
   * Creates a store over an existing schema; call {@link #ensureSchema()} first on a fresh
   * database.
   *
   * @param ds pooled datasource
   */
  public JdbcTrustLineStore(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  /**
   * Creates the tables and indexes if missing and seeds one row per {@link GlobalField}, so
   * {@code increment} only ever updates. Idempotent, and safe when several nodes boot at once.
   *
   * @throws StoreException if the DDL fails
   */
  public void ensureSchema() {
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      for (String ddl : SCHEMA) {
        st.execute(ddl);
      }
      for (GlobalField field : GlobalField.values()) {
        seed(c, field);
      }
    } catch (SQLException e) {
      LOG.error(
          "(trustnet) code={} op={} message={} sqlState={} vendor={}",
          SqlErrorCodes.classify(e),
          "store.ensureSchema",
          e.getMessage(),
          e.getSQLState(),
          e.getErrorCode(),
          e);
      throw StoreException.wrap("store.ensureSchema", e);
    }
  }

  private static void seed(Connection c, GlobalField field) throws SQLException {
    try (PreparedStatement exists =
        c.prepareStatement("SELECT 1 FROM trustnet_globals WHERE field_name=?")) {
      exists.setString(1, field.name());
      try (ResultSet rs = exists.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }
    try (PreparedStatement insert =
        c.prepareStatement("INSERT INTO trustnet_globals(field_name, field_value) VALUES(?, 0)")) {
      insert.setString(1, field.name());
      insert.executeUpdate();
    } catch (SQLException e) {
      if (!SqlErrorCodes.isDuplicateKey(e)) {
        throw e;
      }
      // Another node seeded the row between the check and the insert.
      LOG.debug("(trustnet) op=store.ensureSchema field={} already seeded", field);
    }
  }

  @Override
  public <T> T inTransaction(Work<T> work) {
    Objects.requireNonNull(work, "work");
    try (Connection c = ds.getConnection()) {
      c.setAutoCommit(false);
      try {
        T result = work.run(new JdbcTransaction(c));
        c.commit();
        return result;
      } catch (RuntimeException | SQLException e) {
        rollback(c, e);
        throw e;
      }
    } catch (SQLException e) {
      throw StoreException.wrap("store.commit", e);
    }
  }

  @Override
  public Optional<TrustLine> find(CanonicalPair pair) {
    String sql = "SELECT " + COLUMNS + " FROM trust_lines WHERE account_lo=? AND account_hi=?";
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      bindPair(ps, pair);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(readLine(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw StoreException.wrap("store.find", e);
    }
  }

  @Override
  public List<TrustLine> linesOf(AccountId account, long afterId, int limit) {
    String sql =
        "SELECT "
            + COLUMNS
            + " FROM trust_lines WHERE (account_lo=? OR account_hi=?) AND line_id>?"
            + " ORDER BY line_id LIMIT ?";
    List<TrustLine> out = new ArrayList<>();
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      byte[] id = account.toBytes();
      ps.setBytes(1, id);
      ps.setBytes(2, id);
      ps.setLong(3, afterId);
      ps.setInt(4, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(readLine(rs));
        }
      }
    } catch (SQLException e) {
      throw StoreException.wrap("store.linesOf", e);
    }
    return List.copyOf(out);
  }

  @Override
  public long read(GlobalField field) {
    String sql = "SELECT field_value FROM trustnet_globals WHERE field_name=?";
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, field.name());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    } catch (SQLException e) {
      throw StoreException.wrap("store.read", e);
    }
  }

  /** The datasource lifecycle belongs to whoever created it. */
  @Override
  public void close() {}

  private static void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void bindPair(PreparedStatement ps, CanonicalPair pair) throws SQLException {
    ps.setBytes(1, pair.lo().toBytes());
    ps.setBytes(2, pair.hi().toBytes());
  }

  private static TrustLine readLine(ResultSet rs) throws SQLException {
    CanonicalPair pair =
        new CanonicalPair(AccountId.of(rs.getBytes(1)), AccountId.of(rs.getBytes(2)));
    return new TrustLine(
        pair,
        rs.getLong(3),
        rs.getLong(4),
        rs.getLong(5),
        rs.getLong(6),
        rs.getLong(7),
        rs.getLong(8),
        rs.getLong(9),
        rs.getBoolean(10),
        rs.getLong(11),
        rs.getLong(12));
  }

  private static final class JdbcTransaction implements Transaction {
    private final Connection c;

    JdbcTransaction(Connection c) {
      this.c = c;
    }

    @Override
    public Optional<TrustLine> lockLine(CanonicalPair pair) {
      String sql =
          "SELECT " + COLUMNS + " FROM trust_lines WHERE account_lo=? AND account_hi=? FOR UPDATE";
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        bindPair(ps, pair);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? Optional.of(readLine(rs)) : Optional.empty();
        }
      } catch (SQLException e) {
        throw StoreException.wrap("store.lockLine", e);
      }
    }

    @Override
    public void insert(TrustLine line) {
      String sql =
          "INSERT INTO trust_lines(" + COLUMNS + ") VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        bindPair(ps, line.pair());
        ps.setLong(3, line.id());
        ps.setLong(4, line.assetId());
        ps.setLong(5, line.limitLo());
        ps.setLong(6, line.limitHi());
        ps.setLong(7, line.balance());
        ps.setLong(8, line.qualityIn());
        ps.setLong(9, line.qualityOut());
        ps.setBoolean(10, line.allowRippling());
        ps.setLong(11, line.createdAtS());
        ps.setLong(12, line.updatedAtS());
        ps.executeUpdate();
      } catch (SQLException e) {
        if (SqlErrorCodes.isDuplicateKey(e)) {
          throw new TrustLineException(
              ErrorCode.TRUST_LINE_EXISTS, "trust line already exists for " + line.pair(), e);
        }
        throw StoreException.wrap("store.insert", e);
      }
    }

    @Override
    public void update(TrustLine line) {
      String sql =
          "UPDATE trust_lines SET limit_lo=?, limit_hi=?, balance=?, quality_in=?, quality_out=?,"
              + " allow_rippling=?, updated_at_s=? WHERE account_lo=? AND account_hi=?";
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        ps.setLong(1, line.limitLo());
        ps.setLong(2, line.limitHi());
        ps.setLong(3, line.balance());
        ps.setLong(4, line.qualityIn());
        ps.setLong(5, line.qualityOut());
        ps.setBoolean(6, line.allowRippling());
        ps.setLong(7, line.updatedAtS());
        ps.setBytes(8, line.pair().lo().toBytes());
        ps.setBytes(9, line.pair().hi().toBytes());
        if (ps.executeUpdate() != 1) {
          throw new TrustLineException(
              ErrorCode.TRUST_LINE_NOT_FOUND, "no trust line for " + line.pair());
        }
      } catch (SQLException e) {
        throw StoreException.wrap("store.update", e);
      }
    }

    @Override
    public long increment(GlobalField field) {
      try {
        try (PreparedStatement bump =
            c.prepareStatement(
                "UPDATE trustnet_globals SET field_value = field_value + 1 WHERE field_name=?")) {
          bump.setString(1, field.name());
          if (bump.executeUpdate() != 1) {
            throw new StoreException(
                ErrorCode.STORAGE_FAILURE,
                "store.increment",
                "counter " + field + " is not seeded; run ensureSchema() first",
                null);
          }
        }
        try (PreparedStatement ps =
            c.prepareStatement("SELECT field_value FROM trustnet_globals WHERE field_name=?")) {
          ps.setString(1, field.name());
          try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
              throw new SQLException("counter row vanished: " + field);
            }
            return rs.getLong(1);
          }
        }
      } catch (SQLException e) {
        throw StoreException.wrap("store.increment", e);
      }
    }
  }
}
