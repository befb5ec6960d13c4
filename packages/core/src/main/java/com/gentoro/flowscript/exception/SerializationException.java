package com.gentoro.flowscript.exception;

/** Serialization or deserialization failure (JSON, YAML, templates). */
public class SerializationException extends FlowScriptException {
  public SerializationException(String message) {
    super(FlowScriptErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(FlowScriptErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
