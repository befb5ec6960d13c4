package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.List;

/** W001: an exploring state should say since when. */
public class MissingRecommendedFieldsRule extends BaseLintRule {

  public MissingRecommendedFieldsRule() {
    super("missing-recommended-fields", "W001", Severity.WARNING);
  }

  @Override
  public List<LintResult> check(IR ir) {
    List<LintResult> results = new ArrayList<>();
    for (State state : ir.states()) {
      if (state.type() != StateType.EXPLORING) continue;
      String since = state.field("since");
      if (since == null || since.isBlank()) {
        results.add(
            createResult(
                "[exploring] missing recommended field: since",
                state.provenance(),
                "Add recommended field: since: \"...\""));
      }
    }
    return results;
  }
}
