package com.example.gestureServing.domain;

import java.util.Map;

/**
 * Output of an external inference run, attached to a stored gesture.
 * probs and processingTimeMs are optional.
 */
public record InferenceResult(
    Long modelId,
    String predictedLabel,
    Double confidence,
    Map<String, Double> probs,
    Integer processingTimeMs) {
}
