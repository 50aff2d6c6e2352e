/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Logback side of {@link LoggingConfigurator}. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("plugbar");
  static final String CONSOLE_APPENDER = "plugbar-console";
  static final String PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LogbackConfigurator() {}

  static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      configure(context, logCfg);
    } else {
      LOG.debug(
          "(plugbar) skipping logback configuration; factory is {}", factory.getClass().getName());
    }
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    if (context == null || logCfg == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level level = levelFrom(logCfg.level());
    if (level == null) {
      level = Level.INFO;
      LOG.warn("(plugbar) invalid core.log.level {}; defaulting to INFO", logCfg.level());
    }
    root.setLevel(level);

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    Encoder<ILoggingEvent> encoder = logCfg.json() ? jsonEncoder(context) : patternEncoder(context);
    root.addAppender(consoleAppender(context, encoder));
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    PlugbarJsonLayout layout = new PlugbarJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }

  private static ConsoleAppender<ILoggingEvent> consoleAppender(
      LoggerContext context, Encoder<ILoggingEvent> encoder) {
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    return console;
  }

  private static Level levelFrom(String level) {
    if (level == null || level.isBlank()) {
      return null;
    }
    return Level.toLevel(level.trim(), null);
  }
}
