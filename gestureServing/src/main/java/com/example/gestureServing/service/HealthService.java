package com.example.gestureServing.service;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.example.gestureServing.config.ServingProperties;
import com.example.gestureServing.domain.NewModel;
import com.example.gestureServing.dto.HealthReport;
import com.example.gestureServing.mapper.HealthMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Liveness probe. Never throws: an unreachable database reports "degraded".
 */
@Slf4j
@Service
public class HealthService {

  private final HealthMapper healthMapper;
  private final ModelDbService models;
  private final ServingProperties props;
  private final Clock clock;

  public HealthService(HealthMapper healthMapper, ModelDbService models, ServingProperties props, Clock clock) {
    this.healthMapper = healthMapper;
    this.models = models;
    this.props = props;
    this.clock = clock;
  }

  public HealthReport check() {
    boolean dbOk = false;
    String modelStatus = "unknown";
    try {
      Integer one = healthMapper.ping();
      dbOk = one != null && one == 1;
      if (dbOk) {
        modelStatus = models.countByStatus(NewModel.DEFAULT_STATUS) > 0 ? "loaded" : "no_models";
      }
    } catch (RuntimeException e) {
      log.warn("[HEALTH] database check failed: {}", DbErrors.describe(e));
      dbOk = false;
    }

    return HealthReport.builder()
        .status(dbOk ? "healthy" : "degraded")
        .service(props.getServiceName())
        .version(props.getVersion())
        .databaseStatus(dbOk ? "connected" : "unreachable")
        .modelStatus(modelStatus)
        .timestamp(Instant.now(clock))
        .build();
  }
}
