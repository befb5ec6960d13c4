package com.gentoro.flowscript.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends FlowScriptException {
  public ConfigException(String message) {
    super(FlowScriptErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FlowScriptErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
