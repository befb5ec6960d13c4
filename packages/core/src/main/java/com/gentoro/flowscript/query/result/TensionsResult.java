package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Tensions grouped as requested; exactly one of the three groupings is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TensionsResult(
    @JsonProperty("tensions_by_axis") Map<String, List<TensionDetail>> tensionsByAxis,
    @JsonProperty("tensions_by_node") Map<String, List<TensionDetail>> tensionsByNode,
    @JsonProperty("tensions") List<TensionDetail> tensions,
    @JsonProperty("metadata") Metadata metadata) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record TensionDetail(
      @JsonProperty("source") NodeRef source,
      @JsonProperty("target") NodeRef target,
      @JsonProperty("context") List<NodeRef> context) {}

  public record Metadata(
      @JsonProperty("total_tensions") int totalTensions,
      @JsonProperty("unique_axes") List<String> uniqueAxes,
      @JsonProperty("most_common_axis") @JsonInclude(JsonInclude.Include.ALWAYS)
          String mostCommonAxis) {}
}
