package com.gentoro.flowscript.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends FlowScriptException {
  public ValidationException(String message) {
    super(FlowScriptErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(FlowScriptErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
