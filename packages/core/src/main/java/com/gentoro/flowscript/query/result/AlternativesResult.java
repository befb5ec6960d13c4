package com.gentoro.flowscript.query.result;

/** Result of a decision reconstruction; {@link #format()} names the concrete shape. */
public interface AlternativesResult {
  String format();
}
