package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Full ancestry of a node, ordered from the root cause towards the target.
 *
 * @param causalChain steps from the root; {@code depth} counts down to 1 next to the target
 */
public record WhyChainResult(
    @JsonProperty("target") NodeRef target,
    @JsonProperty("causal_chain") List<CausalStep> causalChain,
    @JsonProperty("root_cause") RootCause rootCause,
    @JsonProperty("metadata") Metadata metadata)
    implements WhyResult {

  public record CausalStep(
      @JsonProperty("depth") int depth,
      @JsonProperty("id") String id,
      @JsonProperty("content") String content,
      @JsonProperty("relationship_type") String relationshipType) {}

  public record RootCause(
      @JsonProperty("id") String id,
      @JsonProperty("content") String content,
      @JsonProperty("is_root") boolean isRoot) {}

  public record Metadata(
      @JsonProperty("total_ancestors") int totalAncestors,
      @JsonProperty("max_depth") int maxDepth,
      @JsonProperty("has_multiple_paths") boolean hasMultiplePaths) {}
}
