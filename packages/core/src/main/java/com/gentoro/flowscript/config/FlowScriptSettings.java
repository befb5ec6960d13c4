package com.gentoro.flowscript.config;

import com.gentoro.flowscript.exception.ConfigException;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Typed view over the {@code flowscript.*} configuration keys.
 *
 * @param parserName value written to the IR metadata {@code parser} field
 * @param indentSize indentation width quoted in scanner diagnostics
 * @param maxNestingDepth block nesting depth above which W002 warns
 * @param maxChainLength causal chain length above which W003 warns
 * @param disabledRules lint rule codes that are not run
 */
public record FlowScriptSettings(
    String parserName,
    int indentSize,
    int maxNestingDepth,
    int maxChainLength,
    Set<String> disabledRules) {

  public static final String DEFAULT_PARSER_NAME = "flowscript-java-parser 1.0.0";

  public FlowScriptSettings {
    if (indentSize < 1) {
      throw new ConfigException("flowscript.scanner.indent-size must be positive: " + indentSize);
    }
    if (maxNestingDepth < 1) {
      throw new ConfigException(
          "flowscript.linter.max-nesting-depth must be positive: " + maxNestingDepth);
    }
    if (maxChainLength < 1) {
      throw new ConfigException(
          "flowscript.linter.max-chain-length must be positive: " + maxChainLength);
    }
    disabledRules = disabledRules == null ? Set.of() : Set.copyOf(disabledRules);
  }

  public static FlowScriptSettings defaults() {
    return new FlowScriptSettings(DEFAULT_PARSER_NAME, 2, 5, 10, Set.of());
  }

  public static FlowScriptSettings from(Configuration cfg) {
    FlowScriptSettings d = defaults();
    if (cfg == null) return d;
    try {
      List<String> disabled =
          cfg.getList(String.class, "flowscript.linter.disabled-rules", List.of());
      return new FlowScriptSettings(
          cfg.getString("flowscript.parser.name", d.parserName()),
          cfg.getInt("flowscript.scanner.indent-size", d.indentSize()),
          cfg.getInt("flowscript.linter.max-nesting-depth", d.maxNestingDepth()),
          cfg.getInt("flowscript.linter.max-chain-length", d.maxChainLength()),
          Set.copyOf(disabled));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid flowscript configuration value", e);
    }
  }

  public boolean isRuleEnabled(String code) {
    return !disabledRules.contains(code);
  }
}
