package com.gentoro.flowscript.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ValidationResult(
    @JsonProperty("valid") boolean valid, @JsonProperty("errors") List<ValidationError> errors) {

  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ValidationResult of(List<ValidationError> errors) {
    return new ValidationResult(errors.isEmpty(), errors);
  }

  /** @param path JSON-style location of the offending value, e.g. {@code nodes[2].id} */
  public record ValidationError(
      @JsonProperty("path") String path, @JsonProperty("message") String message) {}
}
