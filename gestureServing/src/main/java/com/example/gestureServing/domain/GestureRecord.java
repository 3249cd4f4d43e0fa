package com.example.gestureServing.domain;

import java.time.LocalDateTime;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code gestures} table: one captured frame plus the inference
 * result attached to it later (all inference columns stay null until then).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GestureRecord {
  private Long gestureId;
  private Long sessionId;
  private String userId;

  private JsonNode landmarks; // [[x, y], ...]
  private Integer frameWidth;
  private Integer frameHeight;
  private String source;
  private LocalDateTime receivedAt;

  // ===== inference =====
  private Long modelId;
  private String predictedLabel;
  private Double confidence;
  private JsonNode probs;
  private Integer processingTimeMs;
  private LocalDateTime processedAt;
}
