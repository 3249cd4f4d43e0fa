package com.example.gestureServing.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * queued -> succeeded | failed, exactly once.
 */
public enum PredictionStatus {
  QUEUED("queued"),
  SUCCEEDED("succeeded"),
  FAILED("failed");

  private final String value;

  PredictionStatus(String value) {
    this.value = value;
  }

  /** Column value. */
  public String value() {
    return value;
  }

  public static Optional<PredictionStatus> fromValue(String raw) {
    if (raw == null) return Optional.empty();
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (PredictionStatus st : values()) {
      if (st.value.equals(s)) return Optional.of(st);
    }
    return Optional.empty();
  }
}
