package com.gentoro.flowscript;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.flowscript.exception.ErrorDetails;
import com.gentoro.flowscript.ir.IR;

/** Outcome of {@link FlowScript#tryCompile}: exactly one of {@code ir} and {@code error} is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResult(
    @JsonProperty("ir") IR ir, @JsonProperty("error") ErrorDetails error) {

  public static CompileResult success(IR ir) {
    return new CompileResult(ir, null);
  }

  public static CompileResult failure(ErrorDetails error) {
    return new CompileResult(null, error);
  }

  public boolean succeeded() {
    return ir != null;
  }
}
