package com.example.gestureServing.dto;

import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /predictions body. Every field is optional; status, when sent, must be "queued".
 */
@Data
@NoArgsConstructor
public class PredictionSubmission {
  private String requestorUserId;
  private Long sessionId;
  private Long modelId;
  private String status;
  private Map<String, Object> params;
}
