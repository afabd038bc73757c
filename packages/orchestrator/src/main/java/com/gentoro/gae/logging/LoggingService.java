package com.gentoro.gae.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying log levels from application
 * configuration.
 *
 * <p>Levels are read from the {@code logging.level} subtree, e.g.
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.gae: DEBUG
 * }</pre>
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

  /** Apply {@code logging.level.*} entries. Unknown level names are ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      // another slf4j binding is active, nothing to configure
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) continue;
      // hierarchical configurations escape dots inside a node name as ".."
      String name = key.replace("..", ".");
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
