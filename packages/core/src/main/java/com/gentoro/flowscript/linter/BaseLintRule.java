package com.gentoro.flowscript.linter;

import com.gentoro.flowscript.ir.Provenance;

/** Carries a rule's identity and builds results stamped with it. */
public abstract class BaseLintRule implements LintRule {
  private final String name;
  private final String code;
  private final Severity severity;

  protected BaseLintRule(String name, String code, Severity severity) {
    this.name = name;
    this.code = code;
    this.severity = severity;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String code() {
    return code;
  }

  @Override
  public Severity severity() {
    return severity;
  }

  protected LintResult createResult(String message, Provenance at, String suggestion) {
    return new LintResult(severity, code, message, LintResult.Location.of(at), suggestion);
  }

  @Override
  public String toString() {
    return code + " " + name;
  }
}
