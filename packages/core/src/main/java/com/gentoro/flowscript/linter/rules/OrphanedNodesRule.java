package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * E004: nodes with no edge in or out and no place in a hierarchy.
 *
 * <p>Actions, completions and blocks are exempt, as are nodes carrying a state.
 */
public class OrphanedNodesRule extends BaseLintRule {
  private static final Set<NodeType> EXEMPT =
      EnumSet.of(NodeType.ACTION, NodeType.COMPLETION, NodeType.BLOCK);

  public OrphanedNodesRule() {
    super("orphaned-nodes", "E004", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    Set<String> connected = new HashSet<>();
    for (Relationship rel : ir.relationships()) {
      connected.add(rel.source());
      connected.add(rel.target());
    }
    for (Node node : ir.nodes()) {
      if (!node.blockChildren().isEmpty()) {
        connected.add(node.id());
        connected.addAll(node.blockChildren());
      }
      if (!node.children().isEmpty()) {
        connected.add(node.id());
        connected.addAll(node.children());
      }
    }
    for (State state : ir.states()) {
      if (state.attached()) connected.add(state.nodeId());
    }

    List<LintResult> results = new ArrayList<>();
    for (Node node : ir.nodes()) {
      if (connected.contains(node.id()) || EXEMPT.contains(node.type())) continue;
      results.add(
          createResult(
              "Orphaned node detected (no relationships): \"" + node.content() + "\"",
              node.provenance(),
              "Connect with relationship: "
                  + node.content()
                  + " -> {target} OR {source} -> "
                  + node.content()));
    }
    return results;
  }
}
