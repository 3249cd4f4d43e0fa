package com.example.gestureServing.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /gestures body: one frame of 21 hand landmarks.
 */
@Data
@NoArgsConstructor
public class GestureSubmission {

  public static final int LANDMARK_COUNT = 21;

  @NotNull(message = "landmarks are required")
  @Size(min = LANDMARK_COUNT, max = LANDMARK_COUNT, message = "landmarks must contain exactly 21 points")
  private List<@NotNull @Size(min = 2, max = 2, message = "each landmark must be an [x, y] pair") List<@NotNull Double>> landmarks;

  private String userId;
  private Long sessionId;

  @Positive
  private Integer frameWidth;

  @Positive
  private Integer frameHeight;

  private String source;
}
