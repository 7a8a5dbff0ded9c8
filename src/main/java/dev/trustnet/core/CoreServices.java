/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.trustnet.api.TrustLines;
import dev.trustnet.api.events.TrustLineEvents;
import dev.trustnet.modules.journal.JournalService;
import java.time.Clock;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires the store, engines, event bus, metrics and optional modules from a {@link Config}. */
public final class CoreServices implements Services, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final String DEFAULT_ADMIN = "0".repeat(64);

  private final HikariDataSource pool;
  private final TrustLineStore store;
  private final EventBus events;
  private final Metrics metrics;
  private final Governance governance;
  private final TrustLines trustLines;
  private final JournalService journal;

  private CoreServices(
      HikariDataSource pool,
      TrustLineStore store,
      EventBus events,
      Metrics metrics,
      Governance governance,
      TrustLines trustLines,
      JournalService journal) {
    this.pool = pool;
    this.store = store;
    this.events = events;
    this.metrics = metrics;
    this.governance = governance;
    this.trustLines = trustLines;
    this.journal = journal;
  }

  /**
   * Starts core services using the provided configuration.
   *
   * @param cfg runtime configuration
   * @return service container
   */
  public static Services start(Config cfg) {
    return start(cfg, Clock.systemUTC());
  }

  static CoreServices start(Config cfg, Clock clock) {
    LoggingConfigurator.configure(cfg.log());
    if (DEFAULT_ADMIN.equalsIgnoreCase(cfg.core().admin().trim())) {
      LOG.warn(
          "(trustnet) code={} op={} message={}",
          "ADMIN_DEFAULT",
          "config",
          "core.admin is still the all-zero template value; set a real administrator identity");
    }
    Governance governance = cfg.governance();

    HikariDataSource ds = null;
    TrustLineStore store;
    if (cfg.core().backend() == Config.Backend.MARIADB) {
      ds = openPool(cfg.db());
      JdbcTrustLineStore jdbc = new JdbcTrustLineStore(ds);
      try {
        jdbc.ensureSchema();
      } catch (StoreException e) {
        ds.close();
        throw e;
      }
      store = jdbc;
    } else {
      store = new InMemoryTrustLineStore();
    }

    EventBus events = new EventBus();
    Metrics metrics = new Metrics();
    TrustLines trustLines = new TrustLinesImpl(store, events, metrics, governance, clock);
    JournalService journal = JournalService.install(events, cfg.modules().journal(), clock);

    LOG.info(
        "(trustnet) core started (store={}, journal={})",
        cfg.core().backend().name().toLowerCase(Locale.ROOT),
        journal != null);
    return new CoreServices(ds, store, events, metrics, governance, trustLines, journal);
  }

  private static HikariDataSource openPool(Config.Db db) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    hc.setUsername(db.user());
    hc.setPassword(db.password());
    hc.setMaximumPoolSize(db.pool().maxPoolSize());
    hc.setMinimumIdle(Math.min(db.pool().minimumIdle(), db.pool().maxPoolSize()));
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setIdleTimeout(db.pool().idleTimeoutMs());
    hc.setMaxLifetime(db.pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("trustnet-hikari");
    hc.setConnectionInitSql(db.forceUtc() ? "SET time_zone = '+00:00'" : null);

    if (!db.tlsEnabled() && !isLocalHost(db.host())) {
      LOG.warn(
          "(trustnet) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "TLS is disabled for a non-local database host; enable core.db.tls.enabled");
    }
    if ("change-me".equals(db.password())) {
      LOG.warn(
          "(trustnet) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "Database password is still the default 'change-me'; update before production use");
    }

    RuntimeException last = null;
    int attempts = Math.max(1, db.pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        LOG.warn(
            "(trustnet) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        if (attempt < attempts) {
          try {
            Thread.sleep(250L * attempt);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            break;
          }
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  @Override
  public TrustLines trustLines() {
    return trustLines;
  }

  @Override
  public TrustLineEvents events() {
    return events;
  }

  @Override
  public Governance governance() {
    return governance;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  /** Drains the event bus before closing modules so queued events still reach the journal. */
  @Override
  public void shutdown() {
    events.close();
    if (journal != null) {
      journal.close();
    }
    metrics.close();
    store.close();
    if (pool != null) {
      pool.close();
    }
    LOG.info("(trustnet) core stopped");
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  private static boolean isLocalHost(String host) {
    if (host == null) {
      return false;
    }
    String normalized = host.trim();
    return normalized.equalsIgnoreCase("localhost")
        || normalized.equals("127.0.0.1")
        || normalized.equals("::1")
        || normalized.equalsIgnoreCase("[::1]");
  }
}
