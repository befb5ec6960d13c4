package com.gentoro.flowscript.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Render-ready view of an IR: one visual node per IR node, one edge per relationship. */
public record GraphData(
    @JsonProperty("nodes") List<GraphNode> nodes, @JsonProperty("edges") List<GraphEdge> edges) {

  public GraphData {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
  }

  /** @param state joined state marker; null when the node carries none */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record GraphNode(
      @JsonProperty("id") String id,
      @JsonProperty("type") String type,
      @JsonProperty("content") String content,
      @JsonProperty("line_number") int lineNumber,
      @JsonProperty("state") GraphState state,
      @JsonProperty("children") List<String> children) {}

  public record GraphState(
      @JsonProperty("type") String type, @JsonProperty("fields") Map<String, String> fields) {}

  /** @param label tension axis; null for other edges */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record GraphEdge(
      @JsonProperty("source") String source,
      @JsonProperty("target") String target,
      @JsonProperty("type") String type,
      @JsonProperty("label") String label) {}
}
