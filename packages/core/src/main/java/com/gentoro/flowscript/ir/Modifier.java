package com.gentoro.flowscript.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.flowscript.exception.ValidationException;

/** Emphasis prefixes written before an element. */
public enum Modifier {
  URGENT("urgent", "!"),
  STRONG_POSITIVE("strong_positive", "++"),
  HIGH_CONFIDENCE("high_confidence", "*"),
  LOW_CONFIDENCE("low_confidence", "~");

  private final String value;
  private final String marker;

  Modifier(String value, String marker) {
    this.value = value;
    this.marker = marker;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public String marker() {
    return marker;
  }

  public static Modifier fromMarker(String marker) {
    for (Modifier m : values()) {
      if (m.marker.equals(marker)) return m;
    }
    throw new ValidationException("Unknown modifier marker: " + marker);
  }

  @JsonCreator
  public static Modifier fromValue(String value) {
    for (Modifier m : values()) {
      if (m.value.equals(value)) return m;
    }
    throw new ValidationException("Unknown modifier: " + value);
  }
}
