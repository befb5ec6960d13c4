package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.List;

/** E001: every tension must name the axis it trades off on. */
public class UnlabeledTensionRule extends BaseLintRule {

  public UnlabeledTensionRule() {
    super("unlabeled-tension", "E001", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    List<LintResult> results = new ArrayList<>();
    for (Relationship rel : ir.relationships()) {
      if (rel.type() == RelationshipType.TENSION
          && (rel.axisLabel() == null || rel.axisLabel().isBlank())) {
        results.add(
            createResult(
                "Tension marker >< missing required axis label",
                rel.provenance(),
                "Add axis label: ><[dimension of tradeoff]"));
      }
    }
    return results;
  }
}
