package com.example.gestureServing.domain;

import java.util.Map;

public record NewPrediction(
    String requestorUserId,
    Long sessionId,
    Long modelId,
    Map<String, Object> params) {
}
