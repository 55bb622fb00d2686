package com.polydoc.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out SLF4J loggers and applies the {@code logging.level} section of the polydoc YAML to
 * logback:
 *
 * <pre>
 * logging:
 *   level:
 *     root: WARN
 *     com.polydoc.filter: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Applies every configured level. Unknown level names are skipped with a warning; without
   * logback on the classpath nothing changes and logback.xml stays in charge.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("Logger factory {} is not logback, levels left as configured", factory);
      return;
    }
    configuredLevels(cfg).forEach((name, value) -> setLevel(context, name, value));
  }

  /** Logger name to level text, {@code root} mapped to the SLF4J root logger name. */
  static Map<String, String> configuredLevels(Configuration cfg) {
    Map<String, String> levels = new LinkedHashMap<>();
    Configuration section = cfg.subset(LEVEL_PREFIX);
    section
        .getKeys()
        .forEachRemaining(
            key -> {
              String value = section.getString(key, "");
              if (!value.isBlank()) {
                // dotted YAML keys come back with their dots doubled
                String name = key.replace("..", ".");
                levels.put("root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name, value);
              }
            });
    return levels;
  }

  private static void setLevel(LoggerContext context, String name, String value) {
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Ignoring unknown log level '{}' for logger {}", value, name);
      return;
    }
    context.getLogger(name).setLevel(level);
    log.debug("Logger {} set to {}", name, level);
  }
}
