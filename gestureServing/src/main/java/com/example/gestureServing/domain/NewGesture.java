package com.example.gestureServing.domain;

import java.util.List;

public record NewGesture(
    List<List<Double>> landmarks,
    Long sessionId,
    String userId,
    Integer frameWidth,
    Integer frameHeight,
    String source) {

  public static final String DEFAULT_SOURCE = "web";

  public static NewGesture ofLandmarks(List<List<Double>> landmarks, String userId) {
    return new NewGesture(landmarks, null, userId, null, null, null);
  }
}
