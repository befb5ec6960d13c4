package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Side by side view of every alternative plus a summary of the decision. */
public record AlternativesComparison(
    @JsonProperty("format") String format,
    @JsonProperty("question") NodeRef question,
    @JsonProperty("alternatives") List<AlternativeDetail> alternatives,
    @JsonProperty("decision_summary") DecisionSummary decisionSummary)
    implements AlternativesResult {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record AlternativeDetail(
      @JsonProperty("id") String id,
      @JsonProperty("content") String content,
      @JsonProperty("chosen") boolean chosen,
      @JsonProperty("rationale") String rationale,
      @JsonProperty("decided_on") String decidedOn,
      @JsonProperty("rejection_reasons") List<String> rejectionReasons,
      @JsonProperty("consequences") List<NodeRef> consequences,
      @JsonProperty("tensions") List<TensionInfo> tensions) {}

  /** @param keyFactors distinct tension axes of the chosen alternative */
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public record DecisionSummary(
      @JsonProperty("chosen") String chosen,
      @JsonProperty("rationale") String rationale,
      @JsonProperty("rejected") List<String> rejected,
      @JsonProperty("key_factors") List<String> keyFactors) {}
}
