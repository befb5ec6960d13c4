package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Declarative guarantees advertised to consumers. The linter is what actually enforces them. */
public record Invariants(
    @JsonProperty("causal_acyclic") boolean causalAcyclic,
    @JsonProperty("all_nodes_reachable") boolean allNodesReachable,
    @JsonProperty("tension_axes_labeled") boolean tensionAxesLabeled,
    @JsonProperty("state_fields_present") boolean stateFieldsPresent) {

  public static Invariants advertised() {
    return new Invariants(true, true, true, true);
  }
}
