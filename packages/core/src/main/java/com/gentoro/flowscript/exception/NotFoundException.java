package com.gentoro.flowscript.exception;

/** Node or other graph element requested was not found. */
public class NotFoundException extends FlowScriptException {
  public NotFoundException(String message) {
    super(FlowScriptErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(FlowScriptErrorCode.NOT_FOUND, message, cause);
  }
}
