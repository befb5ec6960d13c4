package com.gentoro.flowscript.linker;

import com.gentoro.flowscript.ir.ContentHash;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Provenance;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.logging.LoggingService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Post-parse resolution over the flat IR lists.
 *
 * <ol>
 *   <li>Attach each state to the first node occurrence at or after its line.
 *   <li>Connect each question to the alternatives that follow it, up to the next question.
 *   <li>Fill {@code children}: question alternatives, then block members hoisted onto the node
 *       that precedes the block.
 * </ol>
 *
 * <p>Steps 1 and 2 walk occurrences, not the deduplicated node list: content written twice is one
 * node but two positions. Without occurrences each node stands for itself at its provenance line.
 * States that already carry a node id keep it; relinking a linked IR whose content never repeats
 * leaves it unchanged.
 */
public class IrLinker {
  private static final Logger log = LoggingService.getLogger(IrLinker.class);

  public IR link(IR ir) {
    return link(ir, occurrencesOf(ir.nodes()));
  }

  /**
   * @param occurrences every place a node was written, in document order
   */
  public IR link(IR ir, List<Occurrence> occurrences) {
    Map<String, Node> byId = new HashMap<>();
    ir.nodes().forEach(n -> byId.putIfAbsent(n.id(), n));
    List<Occurrence> known =
        occurrences.stream().filter(o -> byId.containsKey(o.nodeId())).toList();

    List<State> states = attachStates(known, ir.states());
    List<Relationship> relationships = linkAlternatives(known, byId, ir.relationships());
    List<Node> nodes = populateChildren(ir.nodes(), relationships);
    return new IR(ir.version(), nodes, relationships, states, ir.invariants(), ir.metadata());
  }

  static List<Occurrence> occurrencesOf(List<Node> nodes) {
    return nodes.stream()
        .map(n -> new Occurrence(n.id(), n.provenance().lineNumber()))
        .toList();
  }

  List<State> attachStates(List<Occurrence> occurrences, List<State> states) {
    List<State> result = new ArrayList<>(states.size());
    for (State state : states) {
      if (state.attached()) {
        result.add(state);
        continue;
      }
      int line = state.provenance().lineNumber();
      Occurrence target = null;
      for (Occurrence occurrence : occurrences) {
        if (occurrence.line() >= line) {
          target = occurrence;
          break;
        }
      }
      if (target == null) {
        log.debug("State {} at line {} has no node to attach to", state.type().value(), line);
        result.add(state);
      } else {
        result.add(state.withNodeId(target.nodeId()));
      }
    }
    return result;
  }

  List<Relationship> linkAlternatives(
      List<Occurrence> occurrences, Map<String, Node> nodes, List<Relationship> relationships) {
    List<Relationship> result = new ArrayList<>(relationships);
    Set<String> known = new HashSet<>();
    relationships.forEach(r -> known.add(r.id()));

    for (int i = 0; i < occurrences.size(); i++) {
      Node question = nodes.get(occurrences.get(i).nodeId());
      if (question.type() != NodeType.QUESTION) continue;
      for (int j = i + 1; j < occurrences.size(); j++) {
        Occurrence at = occurrences.get(j);
        Node candidate = nodes.get(at.nodeId());
        if (candidate.type() == NodeType.QUESTION) break;
        if (candidate.type() != NodeType.ALTERNATIVE) continue;
        String id = ContentHash.link(RelationshipType.ALTERNATIVE, question.id(), candidate.id());
        if (known.add(id)) {
          Provenance origin = candidate.provenance();
          result.add(
              new Relationship(
                  id,
                  RelationshipType.ALTERNATIVE,
                  question.id(),
                  candidate.id(),
                  null,
                  new Provenance(origin.sourceFile(), at.line(), origin.timestamp())));
        }
      }
    }
    return result;
  }

  List<Node> populateChildren(List<Node> nodes, List<Relationship> relationships) {
    Map<String, LinkedHashSet<String>> children = new LinkedHashMap<>();
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      index.put(nodes.get(i).id(), i);
    }

    for (Relationship r : relationships) {
      if (r.type() != RelationshipType.ALTERNATIVE) continue;
      Integer source = index.get(r.source());
      if (source != null && nodes.get(source).type() == NodeType.QUESTION) {
        children.computeIfAbsent(r.source(), k -> new LinkedHashSet<>()).add(r.target());
      }
    }

    for (Node block : nodes) {
      if (block.type() != NodeType.BLOCK) continue;
      List<String> members =
          block.blockChildren().stream()
              .filter(id -> index.containsKey(id))
              .filter(id -> nodes.get(index.get(id)).type() != NodeType.BLOCK)
              .toList();
      if (members.isEmpty()) continue;
      int firstIdx = index.get(members.get(0));
      if (firstIdx == 0) continue;
      Node predecessor = nodes.get(firstIdx - 1);
      if (predecessor.type() == NodeType.BLOCK) continue;
      children.computeIfAbsent(predecessor.id(), k -> new LinkedHashSet<>()).addAll(members);
    }

    List<Node> result = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      LinkedHashSet<String> ids = children.get(node.id());
      result.add(node.withChildren(ids == null ? List.of() : new ArrayList<>(ids)));
    }
    return result;
  }
}
