package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Directed typed edge between two node ids. */
public record Relationship(
    @JsonProperty("id") String id,
    @JsonProperty("type") RelationshipType type,
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("axis_label") String axisLabel,
    @JsonProperty("provenance") Provenance provenance) {}
