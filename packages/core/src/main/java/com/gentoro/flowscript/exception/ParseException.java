package com.gentoro.flowscript.exception;

import java.util.Map;

/** Source text did not match the grammar. No partial result is produced. */
public class ParseException extends FlowScriptException {
  private final int line;
  private final int column;

  public ParseException(String message, int line, int column) {
    super(FlowScriptErrorCode.PARSE_ERROR, message, Map.of("line", line, "column", column));
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
