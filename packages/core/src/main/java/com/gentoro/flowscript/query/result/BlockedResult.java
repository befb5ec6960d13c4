package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Blocked nodes ordered by impact, then by how long they have been blocked. */
public record BlockedResult(
    @JsonProperty("blockers") List<BlockerDetail> blockers,
    @JsonProperty("metadata") Metadata metadata) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record BlockerDetail(
      @JsonProperty("node") NodeRef node,
      @JsonProperty("blocked_state") BlockedState blockedState,
      @JsonProperty("transitive_causes") List<NodeRef> transitiveCauses,
      @JsonProperty("transitive_effects") List<NodeRef> transitiveEffects,
      @JsonProperty("impact_score") int impactScore) {}

  public record BlockedState(
      @JsonProperty("reason") String reason,
      @JsonProperty("since") String since,
      @JsonProperty("days_blocked") long daysBlocked) {}

  public record Metadata(
      @JsonProperty("total_blockers") int totalBlockers,
      @JsonProperty("high_priority_count") int highPriorityCount,
      @JsonProperty("average_days_blocked") double averageDaysBlocked,
      @JsonProperty("oldest_blocker") @JsonInclude(JsonInclude.Include.ALWAYS)
          OldestBlocker oldestBlocker) {}

  public record OldestBlocker(@JsonProperty("id") String id, @JsonProperty("days") long days) {}
}
