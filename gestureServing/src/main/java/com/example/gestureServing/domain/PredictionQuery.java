package com.example.gestureServing.domain;

public record PredictionQuery(Long sessionId, int limit) {

  public static final int DEFAULT_LIMIT = 100;

  public static PredictionQuery recent() {
    return new PredictionQuery(null, DEFAULT_LIMIT);
  }
}
