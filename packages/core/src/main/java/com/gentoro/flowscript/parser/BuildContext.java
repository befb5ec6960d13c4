package com.gentoro.flowscript.parser;

import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Provenance;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.linker.Occurrence;
import com.gentoro.flowscript.scanner.ScanResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Collections filled while one document is turned into IR. Owned by a single parse call. */
final class BuildContext {
  private final String sourceFile;
  private final String timestamp;
  private final ScanResult scan;

  private final List<Node> nodes = new ArrayList<>();
  private final Map<String, Integer> nodeIndex = new HashMap<>();
  private final List<Relationship> relationships = new ArrayList<>();
  private final Set<String> relationshipIds = new HashSet<>();
  private final List<State> states = new ArrayList<>();
  private final List<Occurrence> occurrences = new ArrayList<>();

  BuildContext(String sourceFile, String timestamp, ScanResult scan) {
    this.sourceFile = sourceFile;
    this.timestamp = timestamp;
    this.scan = scan;
  }

  /**
   * Records an occurrence at the node's own line, then appends the node unless one with the same
   * id exists. Returns the node kept in the list.
   */
  Node addNode(Node node) {
    occurrences.add(new Occurrence(node.id(), node.provenance().lineNumber()));
    Integer existing = nodeIndex.get(node.id());
    if (existing != null) {
      return nodes.get(existing);
    }
    nodeIndex.put(node.id(), nodes.size());
    nodes.add(node);
    return node;
  }

  void replace(Node node) {
    Integer idx = nodeIndex.get(node.id());
    if (idx == null) {
      throw new IllegalStateException("No node to replace: " + node.id());
    }
    nodes.set(idx, node);
  }

  Node node(String id) {
    Integer idx = nodeIndex.get(id);
    return idx == null ? null : nodes.get(idx);
  }

  void addRelationship(Relationship relationship) {
    if (relationshipIds.add(relationship.id())) {
      relationships.add(relationship);
    }
  }

  void addState(State state) {
    states.add(state);
  }

  Provenance provenance(int transformedLine) {
    return new Provenance(sourceFile, scan.originalLine(transformedLine), timestamp);
  }

  List<Node> nodes() {
    return List.copyOf(nodes);
  }

  List<Relationship> relationships() {
    return List.copyOf(relationships);
  }

  List<State> states() {
    return List.copyOf(states);
  }

  /** Every node occurrence in creation order, repeats included. */
  List<Occurrence> occurrences() {
    return List.copyOf(occurrences);
  }
}
