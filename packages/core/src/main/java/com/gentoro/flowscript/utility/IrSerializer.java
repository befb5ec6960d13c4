package com.gentoro.flowscript.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.flowscript.exception.SerializationException;
import com.gentoro.flowscript.ir.IR;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes IR documents using the shared {@link JacksonUtility} mappers. */
public final class IrSerializer {
  private IrSerializer() {}

  public static String toJson(IR ir) {
    return JacksonUtility.toJson(ir);
  }

  public static String toYaml(IR ir) {
    try {
      return JacksonUtility.getYamlMapper().writeValueAsString(ir);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize IR to YAML", e);
    }
  }

  public static IR fromJson(String json) {
    if (json == null || json.isBlank()) {
      throw new SerializationException("IR JSON is empty");
    }
    try {
      return JacksonUtility.getJsonMapper().readValue(json, IR.class);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to parse IR JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static void write(IR ir, Path target) {
    try {
      Files.writeString(target, toJson(ir), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SerializationException("Failed to write IR to " + target, e);
    }
  }

  public static IR read(Path source) {
    try {
      return fromJson(Files.readString(source, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SerializationException("Failed to read IR from " + source, e);
    }
  }
}
