package com.example.gestureServing.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.example.gestureServing.BaseIntegrationTest;

@DisplayName("service info")
class ServiceInfoControllerTest extends BaseIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @Test
  @DisplayName("GET /health reports the database and an empty registry")
  void health() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.service").value("Model Serving Microservice"))
        .andExpect(jsonPath("$.database_status").value("connected"))
        .andExpect(jsonPath("$.model_status").value("no_models"))
        .andExpect(jsonPath("$.timestamp").isString());
  }

  @Test
  @DisplayName("GET /health sees an active model")
  void healthWithModel() throws Exception {
    jdbcTemplate.update("""
        INSERT INTO models (name, version, model_type, artifact_uri, input_shape, output_shape)
        VALUES ('asl-mlp', '1.0.0', 'classification', '/models/asl_mlp.onnx', '[42]', '[37]')
        """);

    mockMvc.perform(get("/health"))
        .andExpect(jsonPath("$.model_status").value("loaded"));
  }

  @Test
  @DisplayName("GET / describes the service")
  void root() throws Exception {
    mockMvc.perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("Model Serving Microservice"))
        .andExpect(jsonPath("$.version").value("1.0.0"))
        .andExpect(jsonPath("$.endpoints.health").value("/health"))
        .andExpect(jsonPath("$.endpoints.gestures").value("/gestures"));
  }

  @Test
  @DisplayName("unknown paths stay 404")
  void unknownPath() throws Exception {
    mockMvc.perform(get("/nope"))
        .andExpect(status().isNotFound());
  }
}
