package com.gentoro.flowscript.linter;

/** Lint diagnostic severity. Declaration order is the report order. */
public enum Severity {
  ERROR,
  WARNING
}
