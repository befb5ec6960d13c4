package com.gentoro.flowscript.graph;

import com.gentoro.flowscript.graph.GraphData.GraphEdge;
import com.gentoro.flowscript.graph.GraphData.GraphNode;
import com.gentoro.flowscript.graph.GraphData.GraphState;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.logging.LoggingService;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Projects an IR onto {@link GraphData} for visualization.
 *
 * <p>The mapping is total and one to one: every node type keeps its name, every relationship
 * type keeps its name except {@code causes}, which becomes {@code causal}. States are joined onto
 * the node they are attached to. Type names that are not part of the IR fall back to {@code
 * thought} and {@code causal}; this only ever happens in the projection.
 */
public class GraphProjector {
  private static final Logger log = LoggingService.getLogger(GraphProjector.class);

  static final String FALLBACK_NODE_TYPE = NodeType.THOUGHT.value();
  static final String FALLBACK_EDGE_TYPE = "causal";

  private static final Map<String, String> NODE_TYPES = nodeTypes();
  private static final Map<String, String> EDGE_TYPES = edgeTypes();

  private static Map<String, String> nodeTypes() {
    Map<String, String> m = new LinkedHashMap<>();
    for (NodeType t : NodeType.values()) m.put(t.value(), t.value());
    return Map.copyOf(m);
  }

  private static Map<String, String> edgeTypes() {
    Map<String, String> m = new LinkedHashMap<>();
    for (RelationshipType t : RelationshipType.values()) m.put(t.value(), t.value());
    m.put(RelationshipType.CAUSES.value(), FALLBACK_EDGE_TYPE);
    return Map.copyOf(m);
  }

  public GraphData project(IR ir) {
    Map<String, State> states = new HashMap<>();
    for (State s : ir.states()) {
      if (s.attached()) states.put(s.nodeId(), s);
    }

    List<GraphNode> nodes = new ArrayList<>(ir.nodes().size());
    for (Node node : ir.nodes()) {
      nodes.add(
          new GraphNode(
              node.id(),
              visualNodeType(node.type().value()),
              node.content(),
              node.provenance() == null ? 0 : node.provenance().lineNumber(),
              joinState(states.get(node.id())),
              node.children()));
    }

    List<GraphEdge> edges = new ArrayList<>(ir.relationships().size());
    for (Relationship rel : ir.relationships()) {
      edges.add(
          new GraphEdge(
              rel.source(), rel.target(), visualEdgeType(rel.type().value()), rel.axisLabel()));
    }
    return new GraphData(nodes, edges);
  }

  public static String visualNodeType(String irType) {
    String mapped = NODE_TYPES.get(irType);
    if (mapped == null) {
      log.warn("Unknown IR node type '{}', projecting as '{}'", irType, FALLBACK_NODE_TYPE);
      return FALLBACK_NODE_TYPE;
    }
    return mapped;
  }

  public static String visualEdgeType(String irType) {
    String mapped = EDGE_TYPES.get(irType);
    if (mapped == null) {
      log.warn("Unknown IR relationship type '{}', projecting as '{}'", irType, FALLBACK_EDGE_TYPE);
      return FALLBACK_EDGE_TYPE;
    }
    return mapped;
  }

  private static GraphState joinState(State state) {
    if (state == null) return null;
    Map<String, String> fields = new LinkedHashMap<>();
    for (String required : state.type().requiredFields()) {
      fields.put(required, state.fields().getOrDefault(required, ""));
    }
    state.fields().forEach(fields::putIfAbsent);
    return new GraphState(state.type().value(), fields);
  }

  /** Checks that the projection lost nothing: counts, types, joined states and hierarchy. */
  public VerificationResult verify(IR ir, GraphData data) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    if (ir.nodes().size() != data.nodes().size()) {
      errors.add(
          "Node count mismatch: IR=%d, GraphData=%d"
              .formatted(ir.nodes().size(), data.nodes().size()));
    }
    if (ir.relationships().size() != data.edges().size()) {
      errors.add(
          "Edge count mismatch: IR=%d, GraphData=%d"
              .formatted(ir.relationships().size(), data.edges().size()));
    }

    Set<String> unknownNodes = new LinkedHashSet<>();
    for (Node node : ir.nodes()) {
      if (!NODE_TYPES.containsKey(node.type().value())) unknownNodes.add(node.type().value());
    }
    if (!unknownNodes.isEmpty()) {
      errors.add("Unknown node types: " + String.join(", ", unknownNodes));
    }
    Set<String> unknownEdges = new LinkedHashSet<>();
    for (Relationship rel : ir.relationships()) {
      if (!EDGE_TYPES.containsKey(rel.type().value())) unknownEdges.add(rel.type().value());
    }
    if (!unknownEdges.isEmpty()) {
      errors.add("Unknown edge types: " + String.join(", ", unknownEdges));
    }

    long statedNodes =
        ir.states().stream().filter(State::attached).map(State::nodeId).distinct().count();
    long joined = data.nodes().stream().filter(n -> n.state() != null).count();
    if (statedNodes != joined) {
      warnings.add("State join mismatch: IR=%d, GraphData=%d".formatted(statedNodes, joined));
    }

    long irParents = ir.nodes().stream().filter(n -> !n.children().isEmpty()).count();
    long graphParents =
        data.nodes().stream().filter(n -> n.children() != null && !n.children().isEmpty()).count();
    if (irParents != graphParents) {
      warnings.add(
          "Children array mismatch: IR=%d, GraphData=%d".formatted(irParents, graphParents));
    }

    if (!errors.isEmpty()) {
      log.warn("Projection verification failed: {}", errors);
    }
    return new VerificationResult(errors.isEmpty(), errors, warnings);
  }

  /** Visual type names in IR declaration order, for documentation and tests. */
  public static List<String> visualNodeTypes() {
    return Arrays.stream(NodeType.values())
        .map(t -> NODE_TYPES.get(t.value()))
        .collect(Collectors.toList());
  }
}
