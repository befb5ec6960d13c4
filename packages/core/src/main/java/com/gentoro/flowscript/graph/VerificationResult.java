package com.gentoro.flowscript.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Outcome of comparing a projection against its IR. Warnings do not fail verification. */
public record VerificationResult(
    @JsonProperty("passed") boolean passed,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("warnings") List<String> warnings) {

  public VerificationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }
}
