package com.example.gestureServing.domain;

import java.time.LocalDateTime;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code predictions} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRecord {
  private Long predictionId;
  private String requestorUserId;
  private Long sessionId;
  private Long modelId;

  private String status;
  private JsonNode params;

  private LocalDateTime createdAt;
  private LocalDateTime completedAt;

  // succeeded
  private String outputText;
  private Double confidence;
  private Integer latencyMs;

  // failed
  private String errorMessage;
}
