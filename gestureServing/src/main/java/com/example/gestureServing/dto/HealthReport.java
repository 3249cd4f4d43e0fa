package com.example.gestureServing.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthReport {
  private String status;          // healthy | degraded
  private String service;
  private String version;
  private String databaseStatus;  // connected | unreachable
  private String modelStatus;     // loaded | no_models | unknown
  private Instant timestamp;
}
