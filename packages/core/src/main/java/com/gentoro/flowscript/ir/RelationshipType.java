package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.flowscript.exception.ValidationException;

/** Directed edge kinds. Only {@link #TENSION} carries an axis label. */
public enum RelationshipType {
  CAUSES("causes"),
  TEMPORAL("temporal"),
  DERIVES_FROM("derives_from"),
  BIDIRECTIONAL("bidirectional"),
  TENSION("tension"),
  EQUIVALENT("equivalent"),
  DIFFERENT("different"),
  ALTERNATIVE("alternative"),
  ALTERNATIVE_WORSE("alternative_worse"),
  ALTERNATIVE_BETTER("alternative_better");

  private final String value;

  RelationshipType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static RelationshipType fromValue(String value) {
    for (RelationshipType t : values()) {
      if (t.value.equals(value)) return t;
    }
    throw new ValidationException("Unknown relationship type: " + value);
  }
}
