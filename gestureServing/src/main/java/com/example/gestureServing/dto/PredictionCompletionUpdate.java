package com.example.gestureServing.dto;

import java.util.Map;
import java.util.Set;

import com.example.gestureServing.domain.PredictionCompletion;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion keys of a PUT /predictions/{id} payload.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionCompletionUpdate {

  public static final Set<String> KEYS = Set.of("output_text", "confidence", "latency_ms", "error_message");

  private String outputText;
  private Double confidence;
  private Integer latencyMs;
  private String errorMessage;

  public static boolean isPresentIn(Map<String, Object> payload) {
    return payload != null && payload.keySet().stream().anyMatch(KEYS::contains);
  }

  public PredictionCompletion toCompletion() {
    return new PredictionCompletion(outputText, confidence, latencyMs, errorMessage);
  }
}
