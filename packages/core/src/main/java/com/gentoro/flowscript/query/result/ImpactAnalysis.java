package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Downstream consequences of a node split by distance, with the tensions among them. */
public record ImpactAnalysis(
    @JsonProperty("source") NodeRef source,
    @JsonProperty("impact_tree") ImpactTree impactTree,
    @JsonProperty("tensions_in_impact_zone") List<TensionInfo> tensionsInImpactZone,
    @JsonProperty("metadata") Metadata metadata)
    implements WhatIfResult {

  public record ImpactTree(
      @JsonProperty("direct_consequences") List<Consequence> directConsequences,
      @JsonProperty("indirect_consequences") List<Consequence> indirectConsequences) {}

  /**
   * @param hasTension set on direct consequences only
   * @param tensionAxis set on indirect consequences that take part in a labeled tension
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Consequence(
      @JsonProperty("id") String id,
      @JsonProperty("content") String content,
      @JsonProperty("relationship") String relationship,
      @JsonProperty("depth") int depth,
      @JsonProperty("has_tension") Boolean hasTension,
      @JsonProperty("tension_axis") String tensionAxis) {}

  public record Metadata(
      @JsonProperty("total_descendants") int totalDescendants,
      @JsonProperty("max_depth") int maxDepth,
      @JsonProperty("tension_count") int tensionCount,
      @JsonProperty("has_temporal_consequences") boolean hasTemporalConsequences) {}
}
