package com.gentoro.flowscript.linter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.flowscript.ir.Provenance;

/** One diagnostic produced by a {@link LintRule}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LintResult(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("rule_code") String ruleCode,
    @JsonProperty("message") String message,
    @JsonProperty("location") Location location,
    @JsonProperty("suggestion") String suggestion) {

  public record Location(
      @JsonProperty("file") String file, @JsonProperty("line") int line) {

    public static Location of(Provenance provenance) {
      return provenance == null
          ? null
          : new Location(provenance.sourceFile(), provenance.lineNumber());
    }
  }

  /** Line used for ordering; diagnostics without a location sort as line 0. */
  public int sortLine() {
    return location == null ? 0 : location.line();
  }
}
