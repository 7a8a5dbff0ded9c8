/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Logback side of {@link LoggingConfigurator}: sets the root level and the console appender. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("trustnet");
  static final String CONSOLE_APPENDER = "trustnet-console";
  static final String PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LogbackConfigurator() {}

  static boolean configure(Config.Log logCfg) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      configure(context, logCfg);
      return true;
    }
    LOG.debug(
        "(trustnet) skipping logback configuration; factory is {}", factory.getClass().getName());
    return false;
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    if (context == null || logCfg == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logCfg.level(), Level.INFO));

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    Encoder<ILoggingEvent> encoder =
        logCfg.json() ? jsonEncoder(context) : patternEncoder(context);

    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    root.addAppender(console);
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    Layout<ILoggingEvent> layout = new TrustnetJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }
}
