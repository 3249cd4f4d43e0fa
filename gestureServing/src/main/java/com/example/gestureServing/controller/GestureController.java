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

import com.example.gestureServing.domain.GestureQuery;
import com.example.gestureServing.domain.GestureRecord;
import com.example.gestureServing.domain.NewGesture;
import com.example.gestureServing.dto.GestureInferenceUpdate;
import com.example.gestureServing.dto.GestureSubmission;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.RecordNotFoundException;
import com.example.gestureServing.service.GestureDbService;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@Tag(name = "gestures")
@RestController
@RequestMapping("/gestures")
public class GestureController {

  // submissions over HTTP are tagged "api" unless the client says otherwise
  private static final String HTTP_SOURCE = "api";

  private final GestureDbService gestures;
  private final ListLimits limits;
  private final ObjectMapper om;

  public GestureController(GestureDbService gestures, ListLimits limits, ObjectMapper om) {
    this.gestures = gestures;
    this.limits = limits;
    this.om = om;
  }

  @GetMapping("")
  public List<GestureRecord> list(@RequestParam(name = "user_id", required = false) String userId,
                                  @RequestParam(name = "limit", required = false) Integer limit) {
    return gestures.retrieve(new GestureQuery(userId, limits.resolve(limit)));
  }

  @GetMapping("/{gestureId}")
  public GestureRecord get(@PathVariable long gestureId) {
    return gestures.findById(gestureId)
        .orElseThrow(() -> RecordNotFoundException.of("Gesture", gestureId));
  }

  @PostMapping("")
  public ResponseEntity<?> create(@Valid @RequestBody GestureSubmission req) {
    String source = (req.getSource() == null || req.getSource().isBlank()) ? HTTP_SOURCE : req.getSource();
    long id = gestures.create(new NewGesture(
        req.getLandmarks(),
        req.getSessionId(),
        req.getUserId(),
        req.getFrameWidth(),
        req.getFrameHeight(),
        source));
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("gesture_id", id));
  }

  /**
   * Payload with inference keys ({"predicted_label":"A","confidence":0.95,...})
   * attaches an inference result. Anything else is a generic update, which is
   * not supported.
   */
  @PutMapping("/{gestureId}")
  public ResponseEntity<?> update(@PathVariable long gestureId,
                                  @RequestBody(required = false) Map<String, Object> payload) {
    boolean ok;
    if (GestureInferenceUpdate.isPresentIn(payload)) {
      GestureInferenceUpdate inference;
      try {
        inference = om.convertValue(payload, GestureInferenceUpdate.class);
      } catch (IllegalArgumentException e) {
        throw new InvalidRequestException("Malformed inference payload: " + e.getMessage());
      }
      ok = gestures.attachInference(gestureId, inference.toResult());
    } else {
      ok = gestures.update(gestureId, payload == null ? Map.of() : payload);
    }
    if (!ok) throw new RecordNotFoundException("Gesture not found or nothing to update");
    return ResponseEntity.ok(Map.of("updated", true));
  }

  @DeleteMapping("/{gestureId}")
  public ResponseEntity<?> delete(@PathVariable long gestureId) {
    if (!gestures.delete(gestureId)) throw RecordNotFoundException.of("Gesture", gestureId);
    return ResponseEntity.ok(Map.of("deleted", true));
  }
}
