package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A state marker. {@code nodeId} is empty until the linker attaches it. */
public record State(
    @JsonProperty("id") String id,
    @JsonProperty("type") StateType type,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("fields") Map<String, String> fields,
    @JsonProperty("provenance") Provenance provenance) {

  public State {
    nodeId = nodeId == null ? "" : nodeId;
    fields =
        fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public State withNodeId(String newNodeId) {
    return new State(id, type, newNodeId, fields, provenance);
  }

  public boolean attached() {
    return !nodeId.isEmpty();
  }

  public String field(String name) {
    return fields.get(name);
  }
}
