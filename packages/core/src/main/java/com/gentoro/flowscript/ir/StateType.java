package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.flowscript.exception.ValidationException;
import java.util.List;

/** Out-of-band annotations and the fields each one requires. */
public enum StateType {
  DECIDED("decided", List.of("rationale", "on")),
  EXPLORING("exploring", List.of()),
  BLOCKED("blocked", List.of("reason", "since")),
  PARKING("parking", List.of("why", "until"));

  private final String value;
  private final List<String> requiredFields;

  StateType(String value, List<String> requiredFields) {
    this.value = value;
    this.requiredFields = requiredFields;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public List<String> requiredFields() {
    return requiredFields;
  }

  @JsonCreator
  public static StateType fromValue(String value) {
    for (StateType t : values()) {
      if (t.value.equals(value)) return t;
    }
    throw new ValidationException("Unknown state type: " + value);
  }
}
