package com.gentoro.flowscript.linter.rules;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.linter.BaseLintRule;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * E005: a node must not be its own cause.
 *
 * <p>{@code causes} edges are followed source to target; {@code derives_from} edges target to
 * source, since {@code A <- B} means B produced A. Feedback ({@code <->}) and sequence ({@code
 * =>}) are not causal.
 *
 * <p>Every cycle reachable by depth-first search is reported once. A cycle is rotated to start at
 * its earliest node in document order, and reported at that node.
 */
public class CausalCyclesRule extends BaseLintRule {

  public CausalCyclesRule() {
    super("causal-cycles", "E005", Severity.ERROR);
  }

  @Override
  public List<LintResult> check(IR ir) {
    Map<String, List<String>> adjacency = new LinkedHashMap<>();
    for (Relationship rel : ir.relationships()) {
      switch (rel.type()) {
        case CAUSES -> adjacency.computeIfAbsent(rel.source(), k -> new ArrayList<>())
            .add(rel.target());
        case DERIVES_FROM -> adjacency.computeIfAbsent(rel.target(), k -> new ArrayList<>())
            .add(rel.source());
        default -> {}
      }
    }
    if (adjacency.isEmpty()) return List.of();

    Map<String, Node> nodes = new LinkedHashMap<>();
    Map<String, Integer> order = new HashMap<>();
    for (Node n : ir.nodes()) {
      nodes.putIfAbsent(n.id(), n);
      order.putIfAbsent(n.id(), order.size());
    }
    Comparator<String> documentOrder =
        Comparator.<String>comparingInt(id -> order.getOrDefault(id, Integer.MAX_VALUE))
            .thenComparing(Comparator.naturalOrder());

    List<String> starts = new ArrayList<>(adjacency.keySet());
    starts.sort(documentOrder);

    Map<String, List<String>> cycles = new LinkedHashMap<>();
    for (String start : starts) {
      collectCycles(start, adjacency, new HashSet<>(), new LinkedHashSet<>(), new ArrayList<>(),
          documentOrder, cycles);
    }

    List<List<String>> sorted = new ArrayList<>(cycles.values());
    sorted.sort(Comparator.comparing((List<String> c) -> c.get(0), documentOrder)
        .thenComparing(c -> String.join(",", c)));

    List<LintResult> results = new ArrayList<>();
    for (List<String> cycle : sorted) {
      String rendered =
          cycle.stream()
              .map(id -> nodes.containsKey(id) ? nodes.get(id).content() : shortId(id))
              .collect(Collectors.joining(" -> "));
      Node first = nodes.get(cycle.get(0));
      results.add(
          createResult(
              "Causal cycle detected: " + rendered,
              first == null ? null : first.provenance(),
              "Fix: Use <-> for feedback loops, or use => for temporal sequence,"
                  + " or break the cycle"));
    }
    return results;
  }

  private void collectCycles(
      String node,
      Map<String, List<String>> adjacency,
      Set<String> visited,
      Set<String> onStack,
      List<String> path,
      Comparator<String> documentOrder,
      Map<String, List<String>> cycles) {
    visited.add(node);
    onStack.add(node);
    path.add(node);
    for (String next : adjacency.getOrDefault(node, List.of())) {
      if (onStack.contains(next)) {
        List<String> members = path.subList(path.indexOf(next), path.size());
        List<String> cycle = normalize(members, documentOrder);
        cycles.putIfAbsent(String.join(",", cycle), cycle);
      } else if (!visited.contains(next)) {
        collectCycles(next, adjacency, visited, onStack, path, documentOrder, cycles);
      }
    }
    onStack.remove(node);
    path.remove(path.size() - 1);
  }

  /** Rotates {@code members} to start at its earliest node and closes it, e.g. [A, B, A]. */
  static List<String> normalize(List<String> members, Comparator<String> documentOrder) {
    int start = 0;
    for (int i = 1; i < members.size(); i++) {
      if (documentOrder.compare(members.get(i), members.get(start)) < 0) start = i;
    }
    List<String> cycle = new ArrayList<>(members.size() + 1);
    for (int i = 0; i < members.size(); i++) {
      cycle.add(members.get((start + i) % members.size()));
    }
    cycle.add(cycle.get(0));
    return cycle;
  }

  private static String shortId(String id) {
    return id.length() > 8 ? id.substring(0, 8) : id;
  }
}
