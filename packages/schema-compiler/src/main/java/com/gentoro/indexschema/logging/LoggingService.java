package com.gentoro.indexschema.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out SLF4J loggers and applies the {@code logging.level} section of the YAML configuration
 * to Logback:
 *
 * <pre>
 * logging:
 *   level:
 *     root: WARN
 *     com.gentoro.indexschema.mapping: DEBUG
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
   * Logger levels declared under {@code logging.level}, root first, keyed by logger name. Blank and
   * unknown level names are left out.
   */
  static Map<String, Level> levelsFrom(Configuration cfg) {
    Map<String, Level> levels = new LinkedHashMap<>();
    Configuration section = cfg.subset(LEVEL_PREFIX);
    String root = section.getString("root", null);
    if (root != null) {
      putLevel(levels, Logger.ROOT_LOGGER_NAME, root);
    }
    for (Iterator<String> keys = section.getKeys(); keys.hasNext(); ) {
      String name = keys.next();
      if (!"root".equalsIgnoreCase(name)) {
        putLevel(levels, name, section.getString(name, null));
      }
    }
    return levels;
  }

  /** Applies {@link #levelsFrom(Configuration)} to the Logback context; a null config is a no-op. */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("Logback is not the SLF4J backend, logging.level settings are ignored");
      return;
    }
    levelsFrom(cfg)
        .forEach(
            (name, level) -> {
              context.getLogger(name).setLevel(level);
              log.debug("Logger '{}' set to {}", name, level);
            });
  }

  private static void putLevel(Map<String, Level> levels, String logger, String value) {
    if (value == null || value.isBlank()) return;
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}, ignoring it", value, logger);
      return;
    }
    levels.put(logger, level);
  }
}
