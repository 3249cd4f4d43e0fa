package com.example.gestureServing.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import com.example.gestureServing.BaseIntegrationTest;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("/models")
class ModelControllerTest extends BaseIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper om;

  private static Map<String, Object> registration(String version) {
    Map<String, Object> body = new HashMap<>();
    body.put("name", "asl-mlp");
    body.put("version", version);
    body.put("model_path", "/models/asl_mlp.onnx");
    body.put("input_shape", List.of(42));
    body.put("output_classes", 37);
    return body;
  }

  private ResultActions register(Map<String, Object> body) throws Exception {
    return mockMvc.perform(post("/models")
        .contentType(MediaType.APPLICATION_JSON)
        .content(om.writeValueAsString(body)));
  }

  @Nested
  @DisplayName("POST")
  class Register {

    @Test
    @DisplayName("registers a model and derives output_shape from output_classes")
    void registers() throws Exception {
      register(registration("1.0.0"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.model_id").value(1));

      mockMvc.perform(get("/models/1"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.name").value("asl-mlp"))
          .andExpect(jsonPath("$.model_type").value("classification"))
          .andExpect(jsonPath("$.artifact_uri").value("/models/asl_mlp.onnx"))
          .andExpect(jsonPath("$.input_shape[0]").value(42))
          .andExpect(jsonPath("$.output_shape", hasSize(1)))
          .andExpect(jsonPath("$.output_shape[0]").value(37))
          .andExpect(jsonPath("$.status").value("active"));
    }

    @Test
    @DisplayName("extra keys such as description are ignored")
    void ignoresUnknownKeys() throws Exception {
      Map<String, Object> body = registration("1.0.0");
      body.put("description", "MLP over 21 hand landmarks");
      body.put("metrics", Map.of("accuracy", 0.97));

      register(body).andExpect(status().isCreated());

      mockMvc.perform(get("/models/1"))
          .andExpect(jsonPath("$.metrics.accuracy").value(0.97));
    }

    @Test
    @DisplayName("the same name and version twice is a 409")
    void duplicate() throws Exception {
      register(registration("1.0.0")).andExpect(status().isCreated());

      register(registration("1.0.0"))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    @DisplayName("missing fields are a 400 naming the field")
    void missingField() throws Exception {
      Map<String, Object> body = registration("1.0.0");
      body.remove("model_path");

      register(body)
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validation_errors.model_path").value("model_path is required"));
    }

    @Test
    @DisplayName("a malformed sha256 is a 400")
    void badChecksum() throws Exception {
      Map<String, Object> body = registration("1.0.0");
      body.put("sha256", "abc");

      register(body).andExpect(status().isBadRequest());
    }
  }

  @Test
  @DisplayName("GET lists every model")
  void lists() throws Exception {
    register(registration("1.0.0"));
    register(registration("2.0.0"));

    mockMvc.perform(get("/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[0].version").value("2.0.0"));
  }

  @Test
  @DisplayName("GET of an unknown id is a 404")
  void unknownModel() throws Exception {
    mockMvc.perform(get("/models/999"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Model 999 not found"));
  }

  @Test
  @DisplayName("PUT is not implemented")
  void updateNotImplemented() throws Exception {
    register(registration("1.0.0"));

    mockMvc.perform(put("/models/1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"archived\"}"))
        .andExpect(status().isNotImplemented());
  }

  @Test
  @DisplayName("DELETE of an unknown id is a 404 every time")
  void deleteUnknown() throws Exception {
    mockMvc.perform(delete("/models/999")).andExpect(status().isNotFound());
    mockMvc.perform(delete("/models/999")).andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("DELETE removes a registered model")
  void deletes() throws Exception {
    register(registration("1.0.0"));

    mockMvc.perform(delete("/models/1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(true));
    mockMvc.perform(get("/models/1")).andExpect(status().isNotFound());
  }
}
