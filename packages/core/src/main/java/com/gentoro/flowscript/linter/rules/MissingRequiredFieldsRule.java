package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * E002: decided needs rationale and on, blocked needs reason and since, parking needs why and
 * until. A field that is present but blank counts as missing.
 */
public class MissingRequiredFieldsRule extends BaseLintRule {

  public MissingRequiredFieldsRule() {
    super("missing-required-fields", "E002", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    List<LintResult> results = new ArrayList<>();
    for (State state : ir.states()) {
      List<String> missing =
          state.type().requiredFields().stream()
              .filter(f -> state.field(f) == null || state.field(f).isBlank())
              .toList();
      if (missing.isEmpty()) continue;

      results.add(
          createResult(
              "[%s] state missing required field%s: %s"
                  .formatted(
                      state.type().value(),
                      missing.size() > 1 ? "s" : "",
                      String.join(", ", missing)),
              state.provenance(),
              "Add required fields: "
                  + missing.stream().map(f -> f + ": \"...\"").collect(Collectors.joining(", "))));
    }
    return results;
  }
}
