package com.example.gestureServing.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /models body.
 *
 * model_path becomes the artifact uri; output_classes becomes output_shape [n].
 */
@Data
@NoArgsConstructor
public class ModelRegistrationRequest {

  @NotBlank(message = "name is required")
  private String name;

  @NotBlank(message = "version is required")
  private String version;

  @NotBlank(message = "model_type must not be blank")
  private String modelType = "classification";

  @NotBlank(message = "model_path is required")
  private String modelPath;

  @NotEmpty(message = "input_shape is required")
  private List<@NotNull @Positive Integer> inputShape;

  @NotNull(message = "output_classes is required")
  @Positive(message = "output_classes must be positive")
  private Integer outputClasses;

  private String status;

  private Map<String, Object> metrics;

  @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "sha256 must be 64 hex characters")
  private String sha256;
}
