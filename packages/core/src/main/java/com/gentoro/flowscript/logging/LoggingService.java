package com.gentoro.flowscript.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loggers for FlowScript classes, the per-document MDC scope and log levels from {@code
 * application.yaml}.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     parser: DEBUG            # scanner, grammar, linker
 *     com.gentoro.flowscript.query: TRACE
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private static final String BASE_PACKAGE = "com.gentoro.flowscript";

  /** Short names for the compile stages, each covering one or more packages. */
  static final Map<String, List<String>> STAGES =
      Map.of(
          "parser",
          List.of(BASE_PACKAGE + ".scanner", BASE_PACKAGE + ".parser", BASE_PACKAGE + ".linker"),
          "validation",
          List.of(BASE_PACKAGE + ".validation"),
          "linter",
          List.of(BASE_PACKAGE + ".linter"),
          "query",
          List.of(BASE_PACKAGE + ".query"));

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /** Tags log lines written inside the scope with the document name. */
  public static SourceLogContext forSource(String sourceFile) {
    return new SourceLogContext(sourceFile);
  }

  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback; keeping the binding's own level settings");
      return;
    }

    Configuration levels = cfg.subset("logging.level");
    Iterator<String> it = levels.getKeys();
    while (it.hasNext()) {
      String key = it.next();
      String lvl = levels.getString(key, null);
      if (lvl == null || lvl.isBlank()) continue;
      for (String name : loggerNames(key)) {
        setLevel(ctx.getLogger(name), lvl);
      }
    }
  }

  static List<String> loggerNames(String key) {
    if ("root".equalsIgnoreCase(key)) return List.of(Logger.ROOT_LOGGER_NAME);
    List<String> stage = STAGES.get(key);
    if (stage != null) return stage;
    // Hierarchical keys escape the dots of a logger name as "..".
    return List.of(key.replace("..", "."));
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
