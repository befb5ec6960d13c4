package com.gentoro.flowscript.exception;

/**
 * Canonical error codes for FlowScript. Codes are stable and suitable for tooling and logs. Prefer
 * choosing the most specific code that reflects the failure origin and actionability.
 */
public enum FlowScriptErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Compilation pipeline
  INDENTATION_ERROR,
  PARSE_ERROR,
}
