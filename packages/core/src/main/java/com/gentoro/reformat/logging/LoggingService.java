package com.gentoro.reformat.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying logger levels declared in
 * configuration.
 *
 * <p>Levels are read from keys of the form {@code logging.level.<logger-name>}; the special name
 * {@code root} addresses the root logger. Unknown level names fall back to {@code INFO}.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /** Apply {@code logging.level.*} entries to the running logback context. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      // Another slf4j binding is active; nothing to configure.
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      // Dotted logger names come back with the delimiter escaped as "..".
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String levelName = configuration.getString(key, "INFO");
      Level level = Level.toLevel(levelName, Level.INFO);
      if ("root".equalsIgnoreCase(loggerName)) {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
      } else {
        context.getLogger(loggerName).setLevel(level);
      }
    }
  }
}
