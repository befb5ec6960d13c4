package com.gentoro.flowscript.linter;

import com.gentoro.flowscript.config.FlowScriptSettings;
import com.gentoro.flowscript.exception.ExceptionUtil;
import com.gentoro.flowscript.exception.SerializationException;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.linter.rules.AlternativesWithoutDecisionRule;
import com.gentoro.flowscript.linter.rules.CausalCyclesRule;
import com.gentoro.flowscript.linter.rules.DeepNestingRule;
import com.gentoro.flowscript.linter.rules.InvalidSyntaxRule;
import com.gentoro.flowscript.linter.rules.LongCausalChainsRule;
import com.gentoro.flowscript.linter.rules.MissingRecommendedFieldsRule;
import com.gentoro.flowscript.linter.rules.MissingRequiredFieldsRule;
import com.gentoro.flowscript.linter.rules.OrphanedNodesRule;
import com.gentoro.flowscript.linter.rules.UnlabeledTensionRule;
import com.gentoro.flowscript.logging.LoggingService;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.loader.ClasspathLoader;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Runs the semantic rules over a linked IR.
 *
 * <p>A rule that throws is logged and skipped so the remaining rules still report. Results are
 * ordered errors first, then by ascending line.
 */
public class Linter {
  private static final Logger log = LoggingService.getLogger(Linter.class);
  private static final String REPORT_TEMPLATE = "templates/lint-report.peb";
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder()
          .loader(new ClasspathLoader())
          .autoEscaping(false)
          .newLineTrimming(false)
          .build();

  static final Comparator<LintResult> ORDER =
      Comparator.comparing(LintResult::severity).thenComparingInt(LintResult::sortLine);

  private final List<LintRule> rules = new ArrayList<>();
  private final FlowScriptSettings settings;

  public Linter() {
    this(FlowScriptSettings.defaults());
  }

  public Linter(FlowScriptSettings settings) {
    this.settings = settings;
    rules.add(new UnlabeledTensionRule());
    rules.add(new MissingRequiredFieldsRule());
    rules.add(new InvalidSyntaxRule());
    rules.add(new OrphanedNodesRule());
    rules.add(new CausalCyclesRule());
    rules.add(new AlternativesWithoutDecisionRule());
    rules.add(new MissingRecommendedFieldsRule());
    rules.add(new DeepNestingRule(settings.maxNestingDepth()));
    rules.add(new LongCausalChainsRule(settings.maxChainLength()));
  }

  /** Registers an additional rule, run after the built-in ones. */
  public void addRule(LintRule rule) {
    rules.add(rule);
  }

  public List<LintRule> getRules() {
    return List.copyOf(rules);
  }

  public List<LintResult> lint(IR ir) {
    List<LintResult> results = new ArrayList<>();
    for (LintRule rule : rules) {
      if (!settings.isRuleEnabled(rule.code())) {
        log.trace("Rule {} disabled by configuration", rule.code());
        continue;
      }
      try {
        results.addAll(rule.check(ir));
      } catch (RuntimeException e) {
        log.error(
            "{} at {}",
            ExceptionUtil.summarize(ExceptionUtil.lintFailure(rule.code(), e)),
            ExceptionUtil.formatCompactStackTrace(e));
      }
    }
    results.sort(ORDER);
    log.debug("Lint finished with {} result(s)", results.size());
    return results;
  }

  public List<LintResult> getErrors(List<LintResult> results) {
    return results.stream().filter(r -> r.severity() == Severity.ERROR).toList();
  }

  public List<LintResult> getWarnings(List<LintResult> results) {
    return results.stream().filter(r -> r.severity() == Severity.WARNING).toList();
  }

  public boolean hasErrors(List<LintResult> results) {
    return results.stream().anyMatch(r -> r.severity() == Severity.ERROR);
  }

  /** Human-readable report, one paragraph per result. */
  public String formatResults(List<LintResult> results) {
    if (results.isEmpty()) {
      return "No issues found ✓";
    }
    List<Map<String, Object>> rows = new ArrayList<>(results.size());
    for (LintResult r : results) {
      Map<String, Object> row = new HashMap<>();
      row.put("severity", r.severity().name());
      row.put("rule", r.ruleCode());
      row.put("message", r.message());
      row.put(
          "location",
          r.location() == null ? "unknown" : r.location().file() + ":" + r.location().line());
      row.put("suggestion", r.suggestion());
      rows.add(row);
    }
    try {
      PebbleTemplate template = ENGINE.getTemplate(REPORT_TEMPLATE);
      Writer writer = new StringWriter();
      template.evaluate(writer, Map.of("results", rows));
      return writer.toString();
    } catch (IOException e) {
      throw new SerializationException("Failed to render lint report", e);
    }
  }
}
