package com.example.gestureServing.domain;

/** modelId == null lists everything. */
public record ModelQuery(Long modelId) {

  public static ModelQuery all() {
    return new ModelQuery(null);
  }

  public static ModelQuery byId(long modelId) {
    return new ModelQuery(modelId);
  }
}
