package com.gentoro.flowscript.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.logging.LoggingService;
import com.gentoro.flowscript.utility.JacksonUtility;
import com.gentoro.flowscript.validation.ValidationResult.ValidationError;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Validates the serialized IR against {@link IrSchema}, then runs the {@link
 * ReferentialIrValidator} checks that a schema cannot express.
 *
 * <p>Error paths drop the leading {@code $.}, e.g. {@code nodes[2].provenance.line_number}; a
 * missing required property is reported at the property's own path.
 */
public class SchemaIrValidator implements IrValidator {
  private static final Logger log = LoggingService.getLogger(SchemaIrValidator.class);

  private static final JsonSchemaFactory SCHEMA_FACTORY =
      JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

  private final JsonSchema schema;
  private final IrValidator references;

  public SchemaIrValidator() {
    this(SCHEMA_FACTORY.getSchema(IrSchema.generate()), new ReferentialIrValidator());
  }

  SchemaIrValidator(JsonSchema schema, IrValidator references) {
    this.schema = schema;
    this.references = references;
  }

  @Override
  public ValidationResult validate(IR ir) {
    if (ir == null) {
      return ValidationResult.of(List.of(new ValidationError("$", "IR is null")));
    }
    JsonNode document = JacksonUtility.getJsonMapper().valueToTree(ir);
    Set<ValidationMessage> messages = schema.validate(document);

    List<ValidationError> errors = new ArrayList<>();
    messages.stream()
        .map(SchemaIrValidator::toError)
        .sorted(Comparator.comparing(ValidationError::path))
        .forEach(errors::add);
    errors.addAll(references.validate(ir).errors());

    if (!errors.isEmpty()) {
      log.debug("IR failed validation with {} error(s)", errors.size());
    }
    return ValidationResult.of(errors);
  }

  static ValidationError toError(ValidationMessage message) {
    String location = message.getInstanceLocation().toString();
    String path = location.startsWith("$.") ? location.substring(2) : location;
    if ("required".equals(message.getType()) && message.getProperty() != null) {
      path = "$".equals(path) ? message.getProperty() : path + "." + message.getProperty();
    }
    return new ValidationError(path, message.getMessage());
  }
}
