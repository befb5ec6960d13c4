package com.gentoro.flowscript.validation;

import static com.gentoro.flowscript.ir.IrTestBuilder.ir;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.IrMetadata;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Provenance;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.parser.FlowScriptParser;
import com.gentoro.flowscript.validation.ValidationResult.ValidationError;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class SchemaIrValidatorTest {
  private IrValidator validator;

  @BeforeEach
  void setUp() {
    validator = new SchemaIrValidator();
  }

  @Test
  @DisplayName("Parser output is always valid")
  void parsedDocument() {
    IR parsed =
        new FlowScriptParser()
            .parse(
                "? Which cache\n"
                    + "[decided(rationale: \"speed\", on: \"2024-01-01\")] || Redis\n"
                    + "|| Memcached\n"
                    + "Redis -> Faster pages\n"
                    + "Speed >< [cost] Memory",
                "doc.fs");

    ValidationResult result = validator.validate(parsed);

    assertTrue(result.valid(), () -> result.errors().toString());
  }

  @Test
  @DisplayName("Hand-built graph with states validates")
  void builtGraph() {
    IR built =
        ir().node("a", "A")
            .node("b", "B")
            .causes("a", "b")
            .state(StateType.BLOCKED, "b", "reason", "waiting", "since", "2024-01-01")
            .build();

    assertTrue(validator.validate(built).valid());
  }

  @Test
  @DisplayName("Null IR reports the root path")
  void nullIr() {
    ValidationResult result = validator.validate(null);

    assertFalse(result.valid());
    assertEquals(List.of(new ValidationError("$", "IR is null")), result.errors());
  }

  @Nested
  @DisplayName("Schema checks")
  class SchemaChecks {

    @Test
    @DisplayName("Blank version fails the pattern")
    void blankVersion() {
      IR valid = ir().node("a", "A").build();
      IR noVersion =
          new IR(" ", valid.nodes(), List.of(), List.of(), valid.invariants(), valid.metadata());

      assertThat(validator.validate(noVersion).errors())
          .extracting(ValidationError::path)
          .containsExactly("version");
    }

    @Test
    @DisplayName("Missing provenance fields are reported at their own path")
    void provenance() {
      IR bad =
          ir().node(new Node("a", NodeType.THOUGHT, "A", new Provenance("", 0, "t"), List.of()))
              .node(new Node("b", NodeType.THOUGHT, "B", null, List.of()))
              .build();

      assertThat(validator.validate(bad).errors())
          .extracting(ValidationError::path)
          .containsExactly(
              "nodes[0].provenance.line_number",
              "nodes[0].provenance.source_file",
              "nodes[1].provenance");
    }

    @Test
    @DisplayName("Missing type is a required-property error")
    void missingType() {
      IR bad =
          new IR(
              IR.VERSION,
              List.of(new Node("a", null, "A", new Provenance("x.fs", 1, "t"), List.of())),
              List.of(),
              List.of(),
              null,
              new IrMetadata(List.of("x.fs"), "t", "test"));

      List<ValidationError> errors = validator.validate(bad).errors();

      assertThat(errors).extracting(ValidationError::path).containsExactly("nodes[0].type");
      assertThat(errors.get(0).message()).contains("type");
    }
  }

  @Nested
  @DisplayName("Reference checks")
  class ReferenceChecks {

    @Test
    @DisplayName("Schema errors come before duplicate ids")
    void ids() {
      Provenance p = new Provenance("x.fs", 1, "t");
      IR bad =
          ir().node(new Node("a", NodeType.STATEMENT, "A", p, List.of()))
              .node(new Node("a", NodeType.STATEMENT, "A again", p, List.of()))
              .node(new Node("", NodeType.STATEMENT, "nameless", p, List.of()))
              .build();

      List<ValidationError> errors = validator.validate(bad).errors();

      assertThat(errors).extracting(ValidationError::path).containsExactly(
          "nodes[2].id", "nodes[1].id");
      assertEquals(new ValidationError("nodes[1].id", "duplicate id: a"), errors.get(1));
    }

    @Test
    @DisplayName("Dangling relationship endpoints and states are reported")
    void danglingReferences() {
      IR bad =
          ir().node("a", "A")
              .causes("a", "ghost")
              .state(StateType.PARKING, "phantom", "why", "later", "until", "Q3")
              .build();

      assertEquals(
          List.of(
              new ValidationError("relationships[0].target", "unknown node id: ghost"),
              new ValidationError("states[0].node_id", "unknown node id: phantom")),
          validator.validate(bad).errors());
    }

    @Test
    @DisplayName("Unattached states are allowed")
    void unattachedState() {
      IR ir = ir().node("a", "A").state(StateType.EXPLORING, "").build();

      assertTrue(validator.validate(ir).valid());
    }
  }

  @Nested
  @ExtendWith(MockitoExtension.class)
  @DisplayName("Delegation")
  class Delegation {
    @Mock private IrValidator references;

    @Test
    @DisplayName("Reference errors follow a passing schema check")
    void referenceErrorsAreAppended() {
      IR ir = ir().node("a", "A").build();
      ValidationError error = new ValidationError("nodes[0].id", "duplicate id: a");
      when(references.validate(any())).thenReturn(ValidationResult.of(List.of(error)));
      SchemaIrValidator schemaValidator =
          new SchemaIrValidator(
              JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012)
                  .getSchema(IrSchema.generate()),
              references);

      ValidationResult result = schemaValidator.validate(ir);

      assertEquals(List.of(error), result.errors());
      verify(references).validate(ir);
    }
  }
}
