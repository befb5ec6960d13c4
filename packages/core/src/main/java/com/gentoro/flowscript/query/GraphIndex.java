package com.gentoro.flowscript.query;

import com.gentoro.flowscript.exception.NotFoundException;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only lookups over one IR, built once by {@link QueryEngine#load}.
 *
 * <p>Traversals work on causal direction rather than edge direction: {@code A -> B} makes A the
 * parent of B, while {@code A <- B} makes B the parent of A. Correlation ({@code =}) edges are
 * walked both ways.
 */
final class GraphIndex {

  /** A node reached by a traversal, how far from the start, and over which edge kind. */
  record Reached(Node node, int depth, RelationshipType via) {}

  /** One hop: the node on the far side and the edge that leads there. */
  record Step(String nodeId, Relationship relationship) {}

  private final IR ir;
  private final Map<String, Node> nodes;
  private final Map<String, List<Relationship>> bySource;
  private final Map<String, List<Relationship>> byTarget;
  private final Map<String, State> stateByNode;

  GraphIndex(IR ir) {
    this.ir = ir;
    Map<String, Node> n = new LinkedHashMap<>();
    ir.nodes().forEach(node -> n.put(node.id(), node));
    Map<String, List<Relationship>> src = new HashMap<>();
    Map<String, List<Relationship>> tgt = new HashMap<>();
    for (Relationship rel : ir.relationships()) {
      src.computeIfAbsent(rel.source(), k -> new ArrayList<>()).add(rel);
      tgt.computeIfAbsent(rel.target(), k -> new ArrayList<>()).add(rel);
    }
    Map<String, State> s = new HashMap<>();
    for (State state : ir.states()) {
      if (state.attached()) s.put(state.nodeId(), state);
    }
    this.nodes = Collections.unmodifiableMap(n);
    this.bySource = freeze(src);
    this.byTarget = freeze(tgt);
    this.stateByNode = Collections.unmodifiableMap(s);
  }

  private static Map<String, List<Relationship>> freeze(Map<String, List<Relationship>> m) {
    Map<String, List<Relationship>> out = new HashMap<>();
    m.forEach((k, v) -> out.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(out);
  }

  IR ir() {
    return ir;
  }

  int nodeCount() {
    return nodes.size();
  }

  Node node(String id) {
    return nodes.get(id);
  }

  Node require(String id) {
    Node node = id == null ? null : nodes.get(id);
    if (node == null) {
      throw new NotFoundException("Node not found: " + id);
    }
    return node;
  }

  List<Relationship> outgoing(String id) {
    return bySource.getOrDefault(id, List.of());
  }

  List<Relationship> incoming(String id) {
    return byTarget.getOrDefault(id, List.of());
  }

  State state(String nodeId) {
    return stateByNode.get(nodeId);
  }

  List<Step> parents(String id, Set<RelationshipType> types) {
    List<Step> steps = new ArrayList<>();
    for (Relationship rel : incoming(id)) {
      if (types.contains(rel.type()) && rel.type() != RelationshipType.DERIVES_FROM) {
        steps.add(new Step(rel.source(), rel));
      }
    }
    for (Relationship rel : outgoing(id)) {
      if (!types.contains(rel.type())) continue;
      if (rel.type() == RelationshipType.DERIVES_FROM
          || rel.type() == RelationshipType.EQUIVALENT) {
        steps.add(new Step(rel.target(), rel));
      }
    }
    return steps;
  }

  List<Step> children(String id, Set<RelationshipType> types) {
    List<Step> steps = new ArrayList<>();
    for (Relationship rel : outgoing(id)) {
      if (types.contains(rel.type()) && rel.type() != RelationshipType.DERIVES_FROM) {
        steps.add(new Step(rel.target(), rel));
      }
    }
    for (Relationship rel : incoming(id)) {
      if (!types.contains(rel.type())) continue;
      if (rel.type() == RelationshipType.DERIVES_FROM
          || rel.type() == RelationshipType.EQUIVALENT) {
        steps.add(new Step(rel.source(), rel));
      }
    }
    return steps;
  }

  /** Every ancestor with the depth it was found at; a node reached by two paths appears twice. */
  List<Reached> ancestors(String id, Set<RelationshipType> types, Integer maxDepth) {
    List<Reached> out = new ArrayList<>();
    walk(id, s -> parents(s, types), limit(maxDepth), new HashSet<>(), 0, out);
    return out;
  }

  /** Every descendant with the depth it was found at; a node reached by two paths appears twice. */
  List<Reached> descendants(String id, Set<RelationshipType> types, Integer maxDepth) {
    List<Reached> out = new ArrayList<>();
    walk(id, s -> children(s, types), limit(maxDepth), new HashSet<>(), 0, out);
    return out;
  }

  private int limit(Integer maxDepth) {
    return maxDepth != null ? maxDepth : Math.max(nodes.size(), 1);
  }

  // Each branch gets its own copy of the visited set so diamonds are walked fully while a cycle
  // on a single path still terminates.
  private void walk(
      String id,
      Function<String, List<Step>> next,
      int limit,
      Set<String> visited,
      int depth,
      List<Reached> out) {
    if (depth >= limit || visited.contains(id)) return;
    Set<String> path = new HashSet<>(visited);
    path.add(id);
    for (Step step : next.apply(id)) {
      Node node = nodes.get(step.nodeId());
      if (node == null) continue;
      out.add(new Reached(node, depth + 1, step.relationship().type()));
      walk(step.nodeId(), next, limit, path, depth + 1, out);
    }
  }

  /** Keeps the first entry per node, lowering its depth to the shortest seen. */
  static List<Reached> distinct(List<Reached> reached) {
    Map<String, Reached> byId = new LinkedHashMap<>();
    for (Reached r : reached) {
      byId.merge(r.node().id(), r, (a, b) -> b.depth() < a.depth()
          ? new Reached(a.node(), b.depth(), b.via())
          : a);
    }
    return new ArrayList<>(byId.values());
  }
}
