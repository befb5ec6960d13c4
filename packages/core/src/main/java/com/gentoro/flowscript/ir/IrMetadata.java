package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record IrMetadata(
    @JsonProperty("source_files") List<String> sourceFiles,
    @JsonProperty("parsed_at") String parsedAt,
    @JsonProperty("parser") String parser) {

  public IrMetadata {
    sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
  }
}
