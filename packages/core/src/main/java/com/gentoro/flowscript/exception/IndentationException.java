package com.gentoro.flowscript.exception;

import java.util.Map;

/**
 * Indentation violation found while rewriting indented source into explicit blocks. Always fatal
 * for the document being compiled.
 */
public class IndentationException extends FlowScriptException {
  private final int line;

  public IndentationException(String message, int line) {
    super(
        FlowScriptErrorCode.INDENTATION_ERROR,
        "%s (Line %d)".formatted(message, line),
        Map.of("line", line));
    this.line = line;
  }

  /** 1-indexed line of the original source. */
  public int getLine() {
    return line;
  }
}
