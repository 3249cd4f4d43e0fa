package com.example.gestureServing.dto;

import java.util.Map;
import java.util.Set;

import com.example.gestureServing.domain.InferenceResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inference keys of a PUT /gestures/{id} payload.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GestureInferenceUpdate {

  public static final Set<String> KEYS =
      Set.of("model_id", "predicted_label", "confidence", "probs", "processing_time_ms");

  private Long modelId;
  private String predictedLabel;
  private Double confidence;
  private Map<String, Double> probs;
  private Integer processingTimeMs;

  public static boolean isPresentIn(Map<String, Object> payload) {
    return payload != null && payload.keySet().stream().anyMatch(KEYS::contains);
  }

  public InferenceResult toResult() {
    return new InferenceResult(modelId, predictedLabel, confidence, probs, processingTimeMs);
  }
}
