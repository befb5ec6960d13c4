package com.gentoro.flowscript.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowscript.ir.IR;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import java.math.BigDecimal;
import java.util.Set;

/**
 * JSON Schema (draft 2020-12) of the IR, derived from the Java model and its Jackson names.
 *
 * <p>Identity, type, endpoint and provenance fields are required; ids, endpoints, the version and
 * source files must contain a non-space character; line numbers start at 1.
 */
public final class IrSchema {
  private static final Set<String> REQUIRED =
      Set.of(
          "version",
          "nodes",
          "relationships",
          "states",
          "id",
          "type",
          "source",
          "target",
          "provenance",
          "sourceFile",
          "lineNumber");
  private static final Set<String> NON_BLANK =
      Set.of("version", "id", "source", "target", "sourceFile");

  private static final SchemaGenerator GENERATOR;

  static {
    SchemaGeneratorConfigBuilder configBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
            .with(new JacksonModule(JacksonOption.FLATTENED_ENUMS_FROM_JSONVALUE));
    configBuilder
        .forFields()
        .withRequiredCheck(field -> REQUIRED.contains(field.getDeclaredName()))
        .withStringPatternResolver(
            field -> NON_BLANK.contains(field.getDeclaredName()) ? "\\S" : null)
        .withNumberInclusiveMinimumResolver(
            field -> "lineNumber".equals(field.getDeclaredName()) ? BigDecimal.ONE : null);
    GENERATOR = new SchemaGenerator(configBuilder.build());
  }

  private IrSchema() {}

  public static ObjectNode generate() {
    return GENERATOR.generateSchema(IR.class);
  }

  public static String generateString() {
    return generate().toPrettyString();
  }
}
