package com.gentoro.flowscript.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Structured failure of a compile or lint step, as returned by {@code tryCompile} and logged by the
 * linter. Position fields are set when the failure points at the source.
 *
 * @param type simple class name of the underlying exception
 * @param sourceFile document being compiled, if known
 * @param line 1-indexed line of the original source
 * @param column 1-indexed column, set for parse errors only
 * @param ruleCode lint rule that failed, e.g. {@code E005}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetails(
    @JsonProperty("type") String type,
    @JsonProperty("message") String message,
    @JsonProperty("code") FlowScriptErrorCode code,
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("line") Integer line,
    @JsonProperty("column") Integer column,
    @JsonProperty("rule_code") String ruleCode,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("timestamp") Instant timestamp) {

  public boolean hasPosition() {
    return line != null;
  }
}
