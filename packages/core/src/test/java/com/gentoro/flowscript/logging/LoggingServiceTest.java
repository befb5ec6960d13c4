package com.gentoro.flowscript.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.gentoro.flowscript.config.ConfigurationProvider;
import com.gentoro.flowscript.parser.FlowScriptParser;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class LoggingServiceTest {
  private static final String PARSER_LOGGER = "com.gentoro.flowscript.parser";

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void reset() {
    context.getLogger(PARSER_LOGGER).setLevel(null);
    context.getLogger("com.gentoro.flowscript.query").setLevel(null);
    context.getLogger("com.gentoro.flowscript.scanner").setLevel(null);
    context.getLogger("com.gentoro.flowscript.linker").setLevel(null);
  }

  @Test
  @DisplayName("Dotted logger names under logging.level are applied")
  void appliesNestedLevels() {
    LoggingService.applyConfiguration(
        new ConfigurationProvider("classpath:config/custom.yaml").config());

    assertEquals(Level.DEBUG, context.getLogger(PARSER_LOGGER).getLevel());
  }

  @Test
  @DisplayName("Unknown levels are ignored")
  void unknownLevel() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.com.gentoro.flowscript.query", "LOUD");

    LoggingService.applyConfiguration(cfg);

    assertNull(context.getLogger("com.gentoro.flowscript.query").getLevel());
  }

  @Test
  @DisplayName("Null configuration is a no-op")
  void nullConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }

  @Test
  @DisplayName("A stage name sets every package of that stage")
  void stageAlias() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.parser", "TRACE");

    LoggingService.applyConfiguration(cfg);

    assertEquals(Level.TRACE, context.getLogger("com.gentoro.flowscript.scanner").getLevel());
    assertEquals(Level.TRACE, context.getLogger(PARSER_LOGGER).getLevel());
    assertEquals(Level.TRACE, context.getLogger("com.gentoro.flowscript.linker").getLevel());
  }

  @Test
  @DisplayName("Logger names resolve root, stages and escaped dotted keys")
  void loggerNames() {
    assertEquals(List.of("ROOT"), LoggingService.loggerNames("root"));
    assertEquals(List.of("com.gentoro.flowscript.query"), LoggingService.loggerNames("query"));
    assertEquals(
        List.of("com.gentoro.flowscript.ir"),
        LoggingService.loggerNames("com..gentoro..flowscript..ir"));
  }

  @Test
  @DisplayName("Parsing tags log lines with the document name and clears it afterwards")
  void sourceContextDuringParse() {
    MDC.clear();
    try (SourceLogContext ignored = LoggingService.forSource("outer.fs")) {
      try (SourceLogContext inner = LoggingService.forSource("inner.fs")) {
        assertEquals("inner.fs", MDC.get(SourceLogContext.MDC_SOURCE_FILE));
      }
      assertEquals("outer.fs", MDC.get(SourceLogContext.MDC_SOURCE_FILE));
    }
    assertNull(MDC.get(SourceLogContext.MDC_SOURCE_FILE));

    new FlowScriptParser().parse("A -> B", "doc.fs");
    assertNull(MDC.get(SourceLogContext.MDC_SOURCE_FILE));
  }
}
