package com.example.gestureServing.domain;

/**
 * Outcome of a batch prediction. A non-empty errorMessage means failure and the
 * other fields are ignored.
 */
public record PredictionCompletion(
    String outputText,
    Double confidence,
    Integer latencyMs,
    String errorMessage) {

  public static PredictionCompletion succeeded(String outputText, Double confidence, Integer latencyMs) {
    return new PredictionCompletion(outputText, confidence, latencyMs, null);
  }

  public static PredictionCompletion failed(String errorMessage) {
    return new PredictionCompletion(null, null, null, errorMessage);
  }

  public boolean isFailure() {
    return errorMessage != null && !errorMessage.isEmpty();
  }
}
