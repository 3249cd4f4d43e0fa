package com.example.gestureServing.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.gestureServing.config.ServingProperties;
import com.example.gestureServing.dto.HealthReport;
import com.example.gestureServing.service.HealthService;

import io.swagger.v3.oas.annotations.tags.Tag;

@Tag(name = "health")
@RestController
public class ServiceInfoController {

  private final HealthService healthService;
  private final ServingProperties props;

  public ServiceInfoController(HealthService healthService, ServingProperties props) {
    this.healthService = healthService;
    this.props = props;
  }

  /**
   * Service descriptor.
   */
  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> endpoints = new LinkedHashMap<>();
    endpoints.put("docs", "/swagger-ui.html");
    endpoints.put("openapi", "/v3/api-docs");
    endpoints.put("health", "/health");
    endpoints.put("gestures", "/gestures");
    endpoints.put("models", "/models");
    endpoints.put("predictions", "/predictions");

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("service", props.getServiceName());
    out.put("version", props.getVersion());
    out.put("description", props.getDescription());
    out.put("endpoints", endpoints);
    return out;
  }

  /**
   * Always 200; a dead database shows up as status "degraded".
   */
  @GetMapping("/health")
  public HealthReport health() {
    return healthService.check();
  }
}
