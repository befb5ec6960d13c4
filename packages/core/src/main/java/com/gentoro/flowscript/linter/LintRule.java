package com.gentoro.flowscript.linter;

import com.gentoro.flowscript.ir.IR;
import java.util.List;

/** A graph-level check over a linked IR. Implementations must not modify the IR. */
public interface LintRule {

  /** Kebab-case rule name, e.g. {@code orphaned-nodes}. */
  String name();

  /** Stable rule code, e.g. {@code E004}. */
  String code();

  Severity severity();

  List<LintResult> check(IR ir);
}
