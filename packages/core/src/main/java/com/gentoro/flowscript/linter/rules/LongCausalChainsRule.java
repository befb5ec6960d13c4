package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * W003: a run of {@code ->} edges longer than the configured number of nodes. Only the first such
 * chain is reported.
 */
public class LongCausalChainsRule extends BaseLintRule {
  private final int maxChainLength;

  public LongCausalChainsRule(int maxChainLength) {
    super("long-causal-chains", "W003", Severity.WARNING);
    this.maxChainLength = maxChainLength;
  }

  @Override
  public List<LintResult> check(IR ir) {
    Map<String, List<String>> adjacency = new LinkedHashMap<>();
    for (Relationship rel : ir.relationships()) {
      if (rel.type() == RelationshipType.CAUSES) {
        adjacency.computeIfAbsent(rel.source(), k -> new ArrayList<>()).add(rel.target());
      }
    }

    for (String start : adjacency.keySet()) {
      int length = longestPath(start, adjacency, new HashSet<>());
      if (length > maxChainLength) {
        Node node = ir.findNode(start).orElse(null);
        if (node == null) continue;
        return List.of(
            createResult(
                "Long causal chain detected (more than %d steps)".formatted(maxChainLength),
                node.provenance(),
                "Consider: (1) Adding branching to show parallel effects OR (2) Breaking into"
                    + " multiple related chains"));
      }
    }
    return List.of();
  }

  /** Nodes on the longest simple path from {@code node}; stops once the limit is exceeded. */
  private int longestPath(String node, Map<String, List<String>> adjacency, Set<String> onPath) {
    onPath.add(node);
    int best = onPath.size();
    if (best <= maxChainLength) {
      for (String next : adjacency.getOrDefault(node, List.of())) {
        if (onPath.contains(next)) continue;
        best = Math.max(best, longestPath(next, adjacency, onPath));
        if (best > maxChainLength) break;
      }
    }
    onPath.remove(node);
    return best;
  }
}
