/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.trustnet.api.AccountId;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime configuration loaded from {@code config/trustnet.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Refreshes a {@code trustnet.json5.example} snapshot next to it on every boot.
 *   <li>Supports environment overrides for the administrator ({@code TRUSTNET_ADMIN}) and the DB
 *       connection ({@code TRUSTNET_DB_*}).
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Trustnet v1.0.0 configuration (JSON5 with comments)
      // Drop into config/trustnet.json5. Environment overrides: TRUSTNET_ADMIN,
      // TRUSTNET_DB_HOST|PORT|DATABASE|USER|PASSWORD.
      {
        core: {
          // Administrator identity (64 hex characters). Fixed for the lifetime of the process.
          admin: "0000000000000000000000000000000000000000000000000000000000000000",
          store: {
            // "memory" keeps lines in process; "mariadb" persists them through core.db.
            backend: "memory"
          },
          db: {
            host: "127.0.0.1",
            port: 3306,
            database: "trustnet",
            user: "trustnet",
            password: "change-me",
            tls: { enabled: false },
            session: { forceUtc: true },
            pool: {
              maxPoolSize: 10,
              minimumIdle: 2,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          },
          log: {
            json: false,
            level: "INFO"
          }
        },
        modules: {
          journal: {
            enabled: false,
            path: "./logs/trustnet-journal.jsonl"
          }
        }
      }
      """;

  private static final String HEX_64 = "[0-9a-fA-F]{64}";

  private final Core core;
  private final Modules modules;

  private Config(Core core, Modules modules) {
    this.core = core;
    this.modules = modules;
  }

  /**
   * Core block: administrator, store backend, database and logging.
   *
   * @return core settings
   */
  public Core core() {
    return core;
  }

  public Db db() {
    return core.db();
  }

  public Log log() {
    return core.log();
  }

  /**
   * Optional modules.
   *
   * @return module toggles and settings
   */
  public Modules modules() {
    return modules;
  }

  /**
   * Administrator identity as an immutable governance record.
   *
   * @return governance captured from {@code core.admin}
   */
  public Governance governance() {
    return new Governance(AccountId.fromHex(core.admin()));
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    return loadOrWriteDefault(path, System.getenv());
  }

  static Config loadOrWriteDefault(Path path, Map<String, String> env) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(env, "env");
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("trustnet.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }

      String raw = Files.readString(path, StandardCharsets.UTF_8);
      return parse(raw, env);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  static Config parse(String raw, Map<String, String> env) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalStateException("config is not a JSON5 object: " + e.getMessage(), e);
    }
    JsonObject coreObj = optObject(root, "core");
    if (coreObj == null) {
      throw new IllegalStateException("config missing core{} block");
    }

    String admin = env.getOrDefault("TRUSTNET_ADMIN", optString(coreObj, "admin", null));
    Backend backend = Backend.from(optString(optObject(coreObj, "store"), "backend", "memory"));
    Db db = parseDb(optObject(coreObj, "db"), env);
    Log log = parseLog(optObject(coreObj, "log"));
    Modules modules = parseModules(optObject(root, "modules"));

    Config config = new Config(new Core(admin, backend, db, log), modules);
    validate(config);
    return config;
  }

  /**
   * Removes comments and trailing commas, leaving string literals untouched.
   *
   * @param raw JSON5 text
   * @return plain JSON text
   */
  static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (ch == '"' || ch == '\'') {
        int end = i + 1;
        while (end < n && raw.charAt(end) != ch) {
          end += raw.charAt(end) == '\\' ? 2 : 1;
        }
        end = Math.min(end + 1, n);
        out.append(raw, i, end);
        i = end;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else if (ch == ',' && closesNext(raw, i + 1)) {
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString();
  }

  // True when the next significant character after comments and whitespace closes a block.
  private static boolean closesNext(String raw, int from) {
    int i = from;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else {
        return ch == '}' || ch == ']';
      }
    }
    return false;
  }

  private static Db parseDb(JsonObject db, Map<String, String> env) {
    String envPort = env.get("TRUSTNET_DB_PORT");
    int port;
    try {
      port = envPort != null ? Integer.parseInt(envPort.trim()) : optInt(db, "port", 3306);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("TRUSTNET_DB_PORT must be a number", e);
    }
    String host = env.getOrDefault("TRUSTNET_DB_HOST", optString(db, "host", "127.0.0.1"));
    String database =
        env.getOrDefault("TRUSTNET_DB_DATABASE", optString(db, "database", "trustnet"));
    String user = env.getOrDefault("TRUSTNET_DB_USER", optString(db, "user", "trustnet"));
    String password =
        env.getOrDefault("TRUSTNET_DB_PASSWORD", optString(db, "password", "change-me"));

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject sessionObj = optObject(db, "session");
    boolean forceUtc = sessionObj == null || optBoolean(sessionObj, "forceUtc", true);

    JsonObject poolObj = optObject(db, "pool");
    int maxPool = optInt(poolObj, "maxPoolSize", 10);
    int minIdle = optInt(poolObj, "minimumIdle", 2);
    long connTimeout = optLong(poolObj, "connectionTimeoutMs", 10_000L);
    long idleTimeout = optLong(poolObj, "idleTimeoutMs", 600_000L);
    long maxLifetime = optLong(poolObj, "maxLifetimeMs", 1_700_000L);
    int startupAttempts = optInt(poolObj, "startupAttempts", 3);

    return new Db(
        host,
        port,
        database,
        user,
        password,
        tls,
        forceUtc,
        new Pool(maxPool, minIdle, connTimeout, idleTimeout, maxLifetime, startupAttempts));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static Modules parseModules(JsonObject modules) {
    JsonObject journal = optObject(modules, "journal");
    return new Modules(
        new Journal(
            optBoolean(journal, "enabled", false),
            optString(journal, "path", "./logs/trustnet-journal.jsonl")));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) && !obj.get(key).isJsonNull()
        ? obj.get(key).getAsString()
        : def;
  }

  private static void validate(Config cfg) {
    Core core = cfg.core();
    if (core.admin() == null || !core.admin().trim().matches(HEX_64)) {
      throw new IllegalStateException("core.admin must be 64 hex characters");
    }
    if (core.backend() == Backend.MARIADB) {
      validateDb(core.db());
    }
    validateLog(core.log());
    validateJournal(cfg.modules().journal());
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.host(), "core.db.host");
    requireNonBlank(db.database(), "core.db.database");
    requireNonBlank(db.user(), "core.db.user");
    requireNonBlank(db.password(), "core.db.password");
    if (db.port() <= 0 || db.port() > 65535) {
      throw new IllegalStateException("core.db.port must be between 1 and 65535");
    }
    if (db.host().contains(" ")) {
      throw new IllegalStateException("core.db.host must not contain spaces");
    }
    if (!db.database().matches("[A-Za-z0-9_]+")) {
      throw new IllegalStateException("core.db.database must match [A-Za-z0-9_]+");
    }
    int maxPool = db.pool().maxPoolSize();
    if (maxPool < 1 || maxPool > 50) {
      throw new IllegalStateException("core.db.pool.maxPoolSize must be between 1 and 50");
    }
    int minIdle = db.pool().minimumIdle();
    if (minIdle < 0 || minIdle > maxPool) {
      throw new IllegalStateException("core.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    long connectionTimeout = db.pool().connectionTimeoutMs();
    if (connectionTimeout < 1_000 || connectionTimeout > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    long idleTimeout = db.pool().idleTimeoutMs();
    long maxLifetime = db.pool().maxLifetimeMs();
    if (maxLifetime < 30_000L || maxLifetime > 3_600_000L) {
      throw new IllegalStateException(
          "core.db.pool.maxLifetimeMs must be between 30000 and 3600000");
    }
    if (idleTimeout >= maxLifetime) {
      throw new IllegalStateException("core.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
    int attempts = db.pool().startupAttempts();
    if (attempts < 1 || attempts > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
  }

  private static void validateLog(Log log) {
    requireNonBlank(log.level(), "core.log.level");
    switch (log.level().trim().toUpperCase(Locale.ROOT)) {
      case "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF" -> {}
      default -> throw new IllegalStateException(
          "core.log.level must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF");
    }
  }

  private static void validateJournal(Journal journal) {
    if (journal.enabled()) {
      requireNonBlank(journal.path(), "modules.journal.path");
    }
  }

  private static void requireNonBlank(String value, String path) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(path + " must not be blank");
    }
  }

  /**
   * Core settings.
   *
   * @param admin administrator identity in hex
   * @param backend store backend
   * @param db database block (only used by {@link Backend#MARIADB})
   * @param log logging block
   */
  public record Core(String admin, Backend backend, Db db, Log log) {}

  /** Store backends. */
  public enum Backend {
    MEMORY,
    MARIADB;

    static Backend from(String raw) {
      if (raw == null) {
        return MEMORY;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "memory" -> MEMORY;
        case "mariadb" -> MARIADB;
        default -> throw new IllegalStateException(
            "core.store.backend must be memory or mariadb");
      };
    }
  }

  /**
   * Database connection block.
   *
   * @param host server host
   * @param port server port
   * @param database schema name
   * @param user login
   * @param password secret
   * @param tlsEnabled whether to require TLS
   * @param forceUtc whether sessions run in UTC
   * @param pool connection pool tuning
   */
  public record Db(
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      boolean forceUtc,
      Pool pool) {

    /**
     * Fully formed JDBC URL (MariaDB tuned for UTF-8 + UTC).
     *
     * @return JDBC URL string for MariaDB connections
     */
    public String jdbcUrl() {
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4&serverTimezone=UTC");
      if (tlsEnabled) {
        url.append("&useSsl=true&sslMode=VERIFY_IDENTITY&trustServerCertificate=false");
      } else {
        url.append("&useSsl=false");
      }
      return url.toString();
    }
  }

  /**
   * Connection pool tuning.
   *
   * @param maxPoolSize maximum number of pooled connections
   * @param minimumIdle minimum number of idle connections to retain
   * @param connectionTimeoutMs wait time when borrowing a connection
   * @param idleTimeoutMs idle connection eviction threshold
   * @param maxLifetimeMs maximum lifetime of each connection
   * @param startupAttempts retry count when initializing the pool
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * Logging block.
   *
   * @param json whether to emit one JSON object per line
   * @param level root log level
   */
  public record Log(boolean json, String level) {}

  /**
   * Module settings.
   *
   * @param journal event journal module
   */
  public record Modules(Journal journal) {}

  /**
   * JSONL event journal.
   *
   * @param enabled whether the journal runs
   * @param path output file
   */
  public record Journal(boolean enabled, String path) {}
}
