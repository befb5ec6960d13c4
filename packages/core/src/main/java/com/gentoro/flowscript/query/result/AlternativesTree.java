package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Each alternative with the consequences it causes, recursively. */
public record AlternativesTree(
    @JsonProperty("format") String format,
    @JsonProperty("question") NodeRef question,
    @JsonProperty("alternatives") List<TreeAlternative> alternatives)
    implements AlternativesResult {

  /** A repeated node on one path is cut off with {@code " [cycle detected]"} appended. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record TreeAlternative(
      @JsonProperty("id") String id,
      @JsonProperty("content") String content,
      @JsonProperty("chosen") boolean chosen,
      @JsonProperty("rejection_reasons") List<String> rejectionReasons,
      @JsonProperty("children") List<TreeAlternative> children) {}
}
