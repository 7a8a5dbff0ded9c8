/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code core.log} to the SLF4J backend in use. Only Logback is configured; any other
 * binding is left as the host set it up.
 */
final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("trustnet");
  private static final String LOGBACK_CLASS = "dev.trustnet.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * Configures logging.
   *
   * @param logCfg logging block
   * @return {@code true} if a backend accepted the settings
   */
  static boolean configure(Config.Log logCfg) {
    if (logCfg == null) {
      return false;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      return Boolean.TRUE.equals(configure.invoke(null, logCfg));
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(trustnet) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(trustnet) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(trustnet) failed to configure logging: {}", e.getMessage(), e);
    }
    return false;
  }
}
