package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
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
 * W002: blocks nested deeper than the configured limit.
 *
 * <p>Nesting is read from {@code block_children}, so a question or alternative that owns a block
 * counts as a level.
 */
public class DeepNestingRule extends BaseLintRule {
  private final int maxDepth;

  public DeepNestingRule(int maxDepth) {
    super("deep-nesting", "W002", Severity.WARNING);
    this.maxDepth = maxDepth;
  }

  @Override
  public List<LintResult> check(IR ir) {
    Map<String, Node> blocks = new LinkedHashMap<>();
    Set<String> nested = new HashSet<>();
    for (Node node : ir.nodes()) {
      if (!node.blockChildren().isEmpty()) {
        blocks.put(node.id(), node);
        nested.addAll(node.blockChildren());
      }
    }

    List<LintResult> results = new ArrayList<>();
    for (Node block : blocks.values()) {
      if (!nested.contains(block.id())) {
        walk(block, 1, blocks, new HashSet<>(), results);
      }
    }
    return results;
  }

  private void walk(
      Node block, int depth, Map<String, Node> blocks, Set<String> path, List<LintResult> out) {
    if (!path.add(block.id())) return;
    if (depth > maxDepth) {
      out.add(
          createResult(
              "Thought block nested %d levels deep (max recommended: %d)"
                  .formatted(depth, maxDepth),
              block.provenance(),
              "Consider: (1) Breaking into multiple blocks OR (2) Using flat relationships instead"
                  + " of nesting"));
    }
    for (String childId : block.blockChildren()) {
      Node child = blocks.get(childId);
      if (child != null) {
        walk(child, depth + 1, blocks, path, out);
      }
    }
    path.remove(block.id());
  }
}
