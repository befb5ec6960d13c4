package com.gentoro.flowscript.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowscript.exception.ConfigException;
import com.gentoro.flowscript.exception.FlowScriptErrorCode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {
  private static final String ROOT_PROPERTY = "FLOWSCRIPT_TEST_ROOT";

  @AfterEach
  void clearProperty() {
    System.clearProperty(ROOT_PROPERTY);
  }

  @Test
  @DisplayName("Default location reads application.yaml from the classpath")
  void defaultLocation() {
    Configuration cfg = new ConfigurationProvider().config();

    assertEquals(2, cfg.getInt("flowscript.scanner.indent-size"));
    assertEquals("INFO", cfg.getString("logging.level.root"));
  }

  @Test
  @DisplayName("classpath: prefix loads a named resource")
  void classpathLocation() {
    Configuration cfg = new ConfigurationProvider("classpath:config/custom.yaml").config();

    assertEquals("custom-parser 9.9", cfg.getString("flowscript.parser.name"));
    assertEquals(
        List.of("E004", "W001"), cfg.getList(String.class, "flowscript.linter.disabled-rules"));
  }

  @Test
  @DisplayName("A missing classpath resource yields an empty configuration")
  void missingClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:config/absent.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  @DisplayName("Plain paths and file: URIs load from disk")
  void fileLocation(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("flowscript.yaml");
    Files.writeString(file, "flowscript:\n  linter:\n    max-chain-length: 7\n");

    assertEquals(
        7,
        new ConfigurationProvider(file.toString())
            .config()
            .getInt("flowscript.linter.max-chain-length"));
    assertEquals(
        7,
        new ConfigurationProvider(file.toUri().toString())
            .config()
            .getInt("flowscript.linter.max-chain-length"));
  }

  @Test
  @DisplayName("A missing file is a configuration error")
  void missingFile(@TempDir Path dir) {
    ConfigException ex =
        assertThrows(
            ConfigException.class,
            () -> new ConfigurationProvider(dir.resolve("nope.yaml").toString()));

    assertEquals(FlowScriptErrorCode.CONFIGURATION_ERROR, ex.getCode());
    assertTrue(ex.getMessage().startsWith("Configuration file not found: "));
  }

  @Test
  @DisplayName("env: lookups fall back to system properties")
  void envLookup() {
    System.setProperty(ROOT_PROPERTY, "/srv/notes");

    Configuration cfg = new ConfigurationProvider("classpath:config/custom.yaml").config();

    assertEquals("/srv/notes", cfg.getString("flowscript.sources.root"));
  }
}
