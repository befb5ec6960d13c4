package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/** Root value produced by compilation: flat node, relationship and state collections. */
public record IR(
    @JsonProperty("version") String version,
    @JsonProperty("nodes") List<Node> nodes,
    @JsonProperty("relationships") List<Relationship> relationships,
    @JsonProperty("states") List<State> states,
    @JsonProperty("invariants") Invariants invariants,
    @JsonProperty("metadata") IrMetadata metadata) {

  public static final String VERSION = "1.0.0";

  public IR {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
    states = states == null ? List.of() : List.copyOf(states);
    invariants = invariants == null ? Invariants.advertised() : invariants;
  }

  public Optional<Node> findNode(String id) {
    return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
  }
}
