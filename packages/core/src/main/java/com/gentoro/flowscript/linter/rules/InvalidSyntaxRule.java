package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * E003: constructs that parsed but are not valid FlowScript.
 *
 * <ul>
 *   <li>more than one state attached to a node
 *   <li>prose containing a state marker the grammar could not read, e.g. {@code [decided(oops]}
 *   <li>relationships whose endpoints are not in the node list
 * </ul>
 */
public class InvalidSyntaxRule extends BaseLintRule {
  private static final Pattern DOWNGRADED_MARKER =
      Pattern.compile("\\[(decided|blocked|parking|exploring)\\s*\\(");

  public InvalidSyntaxRule() {
    super("invalid-syntax", "E003", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    List<LintResult> results = new ArrayList<>();
    Map<String, Node> nodes = new LinkedHashMap<>();
    ir.nodes().forEach(n -> nodes.put(n.id(), n));

    Map<String, List<String>> statesByNode = new LinkedHashMap<>();
    for (State state : ir.states()) {
      if (!state.attached()) continue;
      statesByNode
          .computeIfAbsent(state.nodeId(), k -> new ArrayList<>())
          .add(state.type().value());
    }
    for (Map.Entry<String, List<String>> e : statesByNode.entrySet()) {
      Node node = nodes.get(e.getKey());
      if (node == null || e.getValue().size() < 2) continue;
      results.add(
          createResult(
              "Node has multiple states: "
                  + String.join(", ", e.getValue())
                  + " - only one state allowed per node",
              node.provenance(),
              "Choose one state marker"));
    }

    for (Node node : nodes.values()) {
      if (DOWNGRADED_MARKER.matcher(node.content()).find()) {
        results.add(
            createResult(
                "Malformed state marker read as text: \"" + node.content() + "\"",
                node.provenance(),
                "Use [state(field: \"value\", ...)] with a closing ) and ]"));
      }
    }

    Set<String> reported = new HashSet<>();
    for (Relationship rel : ir.relationships()) {
      for (String endpoint : List.of(rel.source(), rel.target())) {
        if (!nodes.containsKey(endpoint) && reported.add(rel.id() + endpoint)) {
          results.add(
              createResult(
                  "Relationship " + rel.type().value() + " references unknown node " + endpoint,
                  rel.provenance(),
                  null));
        }
      }
    }
    return results;
  }
}
