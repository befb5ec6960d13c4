package com.gentoro.flowscript.validation;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.validation.ValidationResult.ValidationError;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-references inside an IR: ids are unique within their collection, relationship endpoints
 * and attached states name known nodes. Shape and required fields are checked against the schema
 * by {@link SchemaIrValidator}; blank or missing values are skipped here.
 */
public class ReferentialIrValidator implements IrValidator {

  @Override
  public ValidationResult validate(IR ir) {
    List<ValidationError> errors = new ArrayList<>();
    if (ir == null) {
      errors.add(new ValidationError("$", "IR is null"));
      return ValidationResult.of(errors);
    }

    Set<String> nodeIds = new HashSet<>();
    for (int i = 0; i < ir.nodes().size(); i++) {
      Node node = ir.nodes().get(i);
      checkUnique(node.id(), "nodes[" + i + "]", nodeIds, errors);
    }

    Set<String> relationshipIds = new HashSet<>();
    for (int i = 0; i < ir.relationships().size(); i++) {
      Relationship rel = ir.relationships().get(i);
      String path = "relationships[" + i + "]";
      checkUnique(rel.id(), path, relationshipIds, errors);
      checkKnown(rel.source(), path + ".source", nodeIds, errors);
      checkKnown(rel.target(), path + ".target", nodeIds, errors);
    }

    Set<String> stateIds = new HashSet<>();
    for (int i = 0; i < ir.states().size(); i++) {
      State state = ir.states().get(i);
      String path = "states[" + i + "]";
      checkUnique(state.id(), path, stateIds, errors);
      if (state.attached()) {
        checkKnown(state.nodeId(), path + ".node_id", nodeIds, errors);
      }
    }
    return ValidationResult.of(errors);
  }

  private static void checkUnique(
      String id, String path, Set<String> seen, List<ValidationError> errors) {
    if (id != null && !id.isBlank() && !seen.add(id)) {
      errors.add(new ValidationError(path + ".id", "duplicate id: " + id));
    }
  }

  private static void checkKnown(
      String id, String path, Set<String> nodeIds, List<ValidationError> errors) {
    if (id != null && !id.isBlank() && !nodeIds.contains(id)) {
      errors.add(new ValidationError(path, "unknown node id: " + id));
    }
  }
}
