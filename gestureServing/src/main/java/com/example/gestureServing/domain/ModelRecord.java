package com.example.gestureServing.domain;

import java.time.LocalDateTime;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code models} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelRecord {
  private Long modelId;
  private String name;
  private String version;
  private String modelType;
  private String artifactUri;

  private JsonNode inputShape;   // [42]
  private JsonNode outputShape;  // [37]

  private String status;
  private JsonNode metrics;
  private String sha256;

  private LocalDateTime createdAt;
}
