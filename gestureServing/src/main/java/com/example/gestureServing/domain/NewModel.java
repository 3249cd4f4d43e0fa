package com.example.gestureServing.domain;

import java.util.List;
import java.util.Map;

/**
 * Fields for registering a model. status/metrics/sha256 may be null.
 */
public record NewModel(
    String name,
    String version,
    String modelType,
    String artifactUri,
    List<Integer> inputShape,
    List<Integer> outputShape,
    String status,
    Map<String, Object> metrics,
    String sha256) {

  public static final String DEFAULT_STATUS = "active";
}
