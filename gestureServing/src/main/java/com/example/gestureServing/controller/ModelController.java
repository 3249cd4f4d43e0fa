package com.example.gestureServing.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.gestureServing.domain.ModelQuery;
import com.example.gestureServing.domain.ModelRecord;
import com.example.gestureServing.domain.NewModel;
import com.example.gestureServing.dto.ModelRegistrationRequest;
import com.example.gestureServing.exception.RecordNotFoundException;
import com.example.gestureServing.service.ModelDbService;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@Tag(name = "models")
@RestController
@RequestMapping("/models")
public class ModelController {

  private final ModelDbService models;

  public ModelController(ModelDbService models) {
    this.models = models;
  }

  @GetMapping("")
  public List<ModelRecord> list() {
    return models.retrieve(ModelQuery.all());
  }

  @GetMapping("/{modelId}")
  public ModelRecord get(@PathVariable long modelId) {
    List<ModelRecord> rows = models.retrieve(ModelQuery.byId(modelId));
    if (rows.isEmpty()) throw RecordNotFoundException.of("Model", modelId);
    return rows.get(0);
  }

  @PostMapping("")
  public ResponseEntity<?> register(@Valid @RequestBody ModelRegistrationRequest req) {
    long id = models.create(new NewModel(
        req.getName(),
        req.getVersion(),
        req.getModelType(),
        req.getModelPath(),
        req.getInputShape(),
        List.of(req.getOutputClasses()),
        req.getStatus(),
        req.getMetrics(),
        req.getSha256()));
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("model_id", id));
  }

  @PutMapping("/{modelId}")
  public ResponseEntity<?> update(@PathVariable long modelId,
                                  @RequestBody(required = false) Map<String, Object> payload) {
    models.update(modelId, payload == null ? Map.of() : payload);
    return ResponseEntity.ok(Map.of("updated", true));
  }

  @DeleteMapping("/{modelId}")
  public ResponseEntity<?> delete(@PathVariable long modelId) {
    if (!models.delete(modelId)) throw RecordNotFoundException.of("Model", modelId);
    return ResponseEntity.ok(Map.of("deleted", true));
  }
}
