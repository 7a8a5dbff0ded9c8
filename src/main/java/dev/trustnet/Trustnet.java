/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet;

import dev.trustnet.core.Config;
import dev.trustnet.core.CoreServices;
import dev.trustnet.core.Services;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trustnet entrypoint.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load config (writes the default JSON5 if missing)
 *   <li>Apply logging settings
 *   <li>Start services (store, event bus, trust line service, journal)
 * </ol>
 *
 * <p>The returned {@link Services} is owned by the caller, who must call {@link
 * Services#shutdown()} when done.
 */
public final class Trustnet {
  /** Project id; also the logger name. */
  public static final String ID = "trustnet";

  private static final Logger LOG = LoggerFactory.getLogger(ID);

  private Trustnet() {}

  /**
   * Boots from {@code config/trustnet.json5} under the working directory.
   *
   * @return running services
   */
  public static Services boot() {
    return boot(Path.of("config", "trustnet.json5"));
  }

  /**
   * Boots from the given config file.
   *
   * @param configPath path of the JSON5 config
   * @return running services
   */
  public static Services boot(Path configPath) {
    LOG.info("(trustnet) booting Trustnet 1.0.0");
    Config cfg = Config.loadOrWriteDefault(configPath);
    Services services = CoreServices.start(cfg);
    LOG.info("(trustnet) initialized");
    return services;
  }
}
