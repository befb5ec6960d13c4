package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.flowscript.ir.Node;

/** Id and content of a node, as it appears in query results. */
public record NodeRef(@JsonProperty("id") String id, @JsonProperty("content") String content) {

  public static NodeRef of(Node node) {
    return new NodeRef(node.id(), node.content());
  }
}
