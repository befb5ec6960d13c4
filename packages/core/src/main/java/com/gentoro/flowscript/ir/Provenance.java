package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Where an IR element came from: file, original 1-indexed line, and ISO-8601 parse time. */
public record Provenance(
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("timestamp") String timestamp) {}
