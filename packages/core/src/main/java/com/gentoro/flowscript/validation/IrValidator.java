package com.gentoro.flowscript.validation;

import com.gentoro.flowscript.ir.IR;

/** Checks that an IR is structurally well formed. Semantic checks belong to the linter. */
public interface IrValidator {
  ValidationResult validate(IR ir);
}
