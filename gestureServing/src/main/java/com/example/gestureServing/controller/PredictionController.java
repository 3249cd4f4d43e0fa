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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.gestureServing.domain.NewPrediction;
import com.example.gestureServing.domain.PredictionQuery;
import com.example.gestureServing.domain.PredictionRecord;
import com.example.gestureServing.domain.PredictionStatus;
import com.example.gestureServing.dto.PredictionCompletionUpdate;
import com.example.gestureServing.dto.PredictionSubmission;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.RecordNotFoundException;
import com.example.gestureServing.service.PredictionDbService;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.swagger.v3.oas.annotations.tags.Tag;

@Tag(name = "predictions")
@RestController
@RequestMapping("/predictions")
public class PredictionController {

  private final PredictionDbService predictions;
  private final ListLimits limits;
  private final ObjectMapper om;

  public PredictionController(PredictionDbService predictions, ListLimits limits, ObjectMapper om) {
    this.predictions = predictions;
    this.limits = limits;
    this.om = om;
  }

  @GetMapping("")
  public List<PredictionRecord> list(@RequestParam(name = "session_id", required = false) Long sessionId,
                                     @RequestParam(name = "limit", required = false) Integer limit) {
    return predictions.retrieve(new PredictionQuery(sessionId, limits.resolve(limit)));
  }

  @GetMapping("/{predictionId}")
  public PredictionRecord get(@PathVariable long predictionId) {
    return predictions.findById(predictionId)
        .orElseThrow(() -> RecordNotFoundException.of("Prediction", predictionId));
  }

  @PostMapping("")
  public ResponseEntity<?> create(@RequestBody(required = false) PredictionSubmission req) {
    PredictionSubmission body = (req == null) ? new PredictionSubmission() : req;

    // jobs can only be born queued
    if (body.getStatus() != null
        && PredictionStatus.fromValue(body.getStatus()).orElse(null) != PredictionStatus.QUEUED) {
      throw new InvalidRequestException("status must be 'queued' for a new prediction");
    }

    long id = predictions.create(new NewPrediction(
        body.getRequestorUserId(),
        body.getSessionId(),
        body.getModelId(),
        body.getParams()));
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(Map.of("prediction_id", id, "status", PredictionStatus.QUEUED.value()));
  }

  /**
   * Completion payload ({"output_text":"HELLO","confidence":0.9} or
   * {"error_message":"..."}) finishes the job; anything else is a generic
   * update, which is not supported.
   */
  @PutMapping("/{predictionId}")
  public ResponseEntity<?> update(@PathVariable long predictionId,
                                  @RequestBody(required = false) Map<String, Object> payload) {
    boolean ok;
    if (PredictionCompletionUpdate.isPresentIn(payload)) {
      PredictionCompletionUpdate completion;
      try {
        completion = om.convertValue(payload, PredictionCompletionUpdate.class);
      } catch (IllegalArgumentException e) {
        throw new InvalidRequestException("Malformed completion payload: " + e.getMessage());
      }
      ok = predictions.markComplete(predictionId, completion.toCompletion());
    } else {
      ok = predictions.update(predictionId, payload == null ? Map.of() : payload);
    }
    if (!ok) throw new RecordNotFoundException("Prediction not found or nothing to update");
    return ResponseEntity.ok(Map.of("updated", true));
  }

  @DeleteMapping("/{predictionId}")
  public ResponseEntity<?> delete(@PathVariable long predictionId) {
    if (!predictions.delete(predictionId)) throw RecordNotFoundException.of("Prediction", predictionId);
    return ResponseEntity.ok(Map.of("deleted", true));
  }
}
