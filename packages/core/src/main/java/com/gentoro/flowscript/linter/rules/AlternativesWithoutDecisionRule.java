package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** E006: a question with alternatives is either decided on one of them or parked. */
public class AlternativesWithoutDecisionRule extends BaseLintRule {

  public AlternativesWithoutDecisionRule() {
    super("alternatives-without-decision", "E006", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    List<LintResult> results = new ArrayList<>();
    for (Node question : ir.nodes()) {
      if (question.type() != NodeType.QUESTION) continue;
      Set<String> alternatives =
          ir.relationships().stream()
              .filter(r -> r.type() == RelationshipType.ALTERNATIVE)
              .filter(r -> r.source().equals(question.id()))
              .map(Relationship::target)
              .collect(Collectors.toSet());
      if (alternatives.isEmpty()) continue;

      boolean decided = false;
      boolean parked = false;
      for (State s : ir.states()) {
        if (s.type() == StateType.DECIDED && alternatives.contains(s.nodeId())) decided = true;
        if (s.type() == StateType.PARKING && s.nodeId().equals(question.id())) parked = true;
      }
      if (!decided && !parked) {
        results.add(
            createResult(
                "Question has alternatives but no decision: \"" + question.content() + "\"",
                question.provenance(),
                "Either: (1) Mark chosen alternative with"
                    + " [decided(rationale: \"...\", on: \"...\")]"
                    + " OR (2) Park question with [parking(why: \"...\", until: \"...\")]"));
      }
    }
    return results;
  }
}
