package com.gentoro.flowscript.exception;

import java.time.Instant;

/** Turns compile and lint failures into {@link ErrorDetails} and one-line summaries. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, null);
  }

  /**
   * Parse and indentation failures keep their source position; other {@link FlowScriptException}s
   * keep code and context. Anything else is {@link FlowScriptErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t, String sourceFile) {
    Integer line = null;
    Integer column = null;
    if (t instanceof ParseException pe) {
      line = pe.getLine();
      column = pe.getColumn();
    } else if (t instanceof IndentationException ie) {
      line = ie.getLine();
    }
    if (t instanceof FlowScriptException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          sourceFile,
          line,
          column,
          null,
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        FlowScriptErrorCode.UNKNOWN,
        sourceFile,
        null,
        null,
        null,
        null,
        Instant.now());
  }

  /** A lint rule threw instead of returning results. */
  public static ErrorDetails lintFailure(String ruleCode, Throwable t) {
    ErrorDetails base = toErrorDetails(t);
    return new ErrorDetails(
        base.type(),
        base.message(),
        base.code(),
        null,
        null,
        null,
        ruleCode,
        base.context(),
        base.timestamp());
  }

  /**
   * One line for logs and command output.
   *
   * <ul>
   *   <li>{@code PARSE_ERROR in plan.fs at line 3, col 3: <message>}
   *   <li>{@code INDENTATION_ERROR at line 2: <message>}
   *   <li>{@code Rule E005 failed with IllegalStateException: <message>}
   * </ul>
   */
  public static String summarize(ErrorDetails details) {
    StringBuilder sb = new StringBuilder();
    if (details.ruleCode() != null) {
      sb.append("Rule ").append(details.ruleCode()).append(" failed with ").append(details.type());
    } else {
      sb.append(details.code());
      if (details.sourceFile() != null) sb.append(" in ").append(details.sourceFile());
      if (details.hasPosition()) {
        sb.append(" at line ").append(details.line());
        if (details.column() != null) sb.append(", col ").append(details.column());
      }
    }
    if (!details.message().isEmpty()) sb.append(": ").append(details.message());
    return sb.toString();
  }

  /**
   * Top stack frames on one line in call order, e.g. {@code
   * com.gentoro.flowscript.linter.rules.CausalCyclesRule.check (CausalCyclesRule.java:42) >
   * com.gentoro.flowscript.linter.Linter.lint (Linter.java:88)}.
   *
   * @param maxFrames frames to include; all of them when {@code <= 0}
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 5);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
