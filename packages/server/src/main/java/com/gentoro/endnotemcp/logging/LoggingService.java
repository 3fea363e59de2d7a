package com.gentoro.endnotemcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and adjust Logback levels at startup. */
public final class LoggingService {
  /** Logger category covering every class of the server. */
  public static final String APPLICATION_LOGGER = "com.gentoro.endnotemcp";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: WARN com.gentoro.endnotemcp: INFO
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    try {
      LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      Iterator<String> it = levels.getKeys();
      while (it.hasNext()) {
        String key = it.next();
        if ("root".equalsIgnoreCase(key)) continue;
        String lvl = levels.getString(key, null);
        if (lvl == null || lvl.isBlank()) continue;
        // Commons Configuration escapes dots inside a YAML key as "..".
        setLevel(ctx.getLogger(key.replace("..", ".")), lvl);
      }
    } catch (Exception e) {
      log.warn(
          "Failed to apply logging configuration from YAML; falling back to logback.xml settings",
          e);
    }
  }

  /**
   * Turn on diagnostic output for the application loggers: connection attempts, SQL executed,
   * tool invocations and resolved document paths are all logged at DEBUG.
   */
  public static void enableVerbose() {
    try {
      LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
      ctx.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
    } catch (ClassCastException e) {
      log.warn("Logback is not the active SLF4J backend; verbose flag ignored");
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
