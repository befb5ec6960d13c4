package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.flowscript.exception.ValidationException;

/** The twelve kinds of node a document can contain. */
public enum NodeType {
  STATEMENT("statement"),
  QUESTION("question"),
  THOUGHT("thought"),
  ACTION("action"),
  BLOCK("block"),
  DECISION("decision"),
  BLOCKER("blocker"),
  INSIGHT("insight"),
  COMPLETION("completion"),
  ALTERNATIVE("alternative"),
  EXPLORING("exploring"),
  PARKING("parking");

  private final String value;

  NodeType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static NodeType fromValue(String value) {
    for (NodeType t : values()) {
      if (t.value.equals(value)) return t;
    }
    throw new ValidationException("Unknown node type: " + value);
  }
}
