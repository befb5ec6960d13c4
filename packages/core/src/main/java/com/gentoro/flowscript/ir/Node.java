package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A unit of thought.
 *
 * <p>{@code children} is the hierarchical nesting filled in by the linker. {@code blockChildren}
 * holds the ids the parser found directly inside a block; it is only set on block-derived nodes.
 */
public record Node(
    @JsonProperty("id") String id,
    @JsonProperty("type") NodeType type,
    @JsonProperty("content") String content,
    @JsonProperty("provenance") Provenance provenance,
    @JsonProperty("children") List<String> children,
    @JsonProperty("modifiers") @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<Modifier> modifiers,
    @JsonProperty("block_children") @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<String> blockChildren) {

  public Node {
    content = content == null ? "" : content;
    children = children == null ? List.of() : List.copyOf(children);
    modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    blockChildren = blockChildren == null ? List.of() : List.copyOf(blockChildren);
  }

  public Node(
      String id, NodeType type, String content, Provenance provenance, List<Modifier> modifiers) {
    this(id, type, content, provenance, List.of(), modifiers, List.of());
  }

  public Node withChildren(List<String> newChildren) {
    return new Node(id, type, content, provenance, newChildren, modifiers, blockChildren);
  }

  /** Same identity and contents, different kind and text: used when a marker owns a block. */
  public Node retag(NodeType newType, String newContent) {
    return new Node(id, newType, newContent, provenance, children, modifiers, blockChildren);
  }
}
