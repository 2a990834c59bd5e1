package com.gentoro.clicky.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and for applying the log levels declared in {@code
 * application.yaml} to Logback.
 *
 * <p>Recognized keys:
 *
 * <ul>
 *   <li>{@code logging.root}: level name for the root logger
 *   <li>{@code logging.loggers}: list of {@code logger.name=LEVEL} entries
 * </ul>
 */
public final class LoggingService {
  private static final Logger log = getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("Logback is not the active SLF4J binding, skipping level configuration");
      return;
    }

    String root = configuration.getString("logging.root", null);
    if (root != null && !root.isBlank()) {
      context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(root.trim(), Level.INFO));
    }

    List<String> entries = configuration.getList(String.class, "logging.loggers", List.of());
    for (String entry : entries) {
      int eq = entry == null ? -1 : entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) {
        log.warn("Ignoring malformed logger level entry '{}'", entry);
        continue;
      }
      String name = entry.substring(0, eq).trim();
      Level level = Level.toLevel(entry.substring(eq + 1).trim(), null);
      if (level == null) {
        log.warn("Unknown log level in entry '{}'", entry);
        continue;
      }
      context.getLogger(name).setLevel(level);
      log.debug("Logger {} set to {}", name, level);
    }
  }
}
