package com.example.gestureServing.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.example.gestureServing.domain.GestureQuery;
import com.example.gestureServing.domain.GestureRecord;
import com.example.gestureServing.domain.InferenceResult;
import com.example.gestureServing.domain.NewGesture;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.UnsupportedRecordOperationException;
import com.example.gestureServing.mapper.GestureMapper;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Captured landmark frames and the inference results attached to them.
 */
@Slf4j
@Service
public class GestureDbService implements RecordService<GestureRecord, NewGesture, GestureQuery> {

  private final GestureMapper mapper;
  private final ObjectMapper om;
  private final Clock clock;

  public GestureDbService(GestureMapper mapper, ObjectMapper om, Clock clock) {
    this.mapper = mapper;
    this.om = om;
    this.clock = clock;
  }

  /**
   * Stores a frame. received_at is taken from this service's clock (UTC).
   * Landmark count is checked by the request layer; here only emptiness.
   */
  @Override
  public long create(NewGesture fields) {
    if (fields.landmarks() == null || fields.landmarks().isEmpty()) {
      throw new InvalidRequestException("landmarks are required");
    }

    String source = (fields.source() == null || fields.source().isBlank())
        ? NewGesture.DEFAULT_SOURCE : fields.source().trim();

    GestureRecord row = GestureRecord.builder()
        .sessionId(fields.sessionId())
        .userId(fields.userId())
        .landmarks(om.valueToTree(fields.landmarks()))
        .frameWidth(fields.frameWidth())
        .frameHeight(fields.frameHeight())
        .source(source)
        .receivedAt(LocalDateTime.now(clock).withNano(0))
        .build();

    try {
      mapper.insert(row);
    } catch (DataAccessException e) {
      log.error("[GESTURES][CREATE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Storing gesture", e);
    }

    log.debug("[GESTURES][CREATE] id={} user={} points={}", row.getGestureId(), row.getUserId(),
        fields.landmarks().size());
    return row.getGestureId();
  }

  /**
   * Writes an inference result onto an existing gesture. model_id,
   * predicted_label and confidence are mandatory and land together with
   * processed_at.
   *
   * @return false when no gesture has this id
   */
  public boolean attachInference(long gestureId, InferenceResult result) {
    if (result == null) throw new InvalidRequestException("inference result is required");
    if (result.modelId() == null) throw new InvalidRequestException("model_id is required");
    if (result.predictedLabel() == null || result.predictedLabel().isBlank()) {
      throw new InvalidRequestException("predicted_label is required");
    }
    Double confidence = result.confidence();
    if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
      throw new InvalidRequestException("confidence must be between 0.0 and 1.0");
    }
    if (result.processingTimeMs() != null && result.processingTimeMs() < 0) {
      throw new InvalidRequestException("processing_time_ms must not be negative");
    }

    GestureRecord update = GestureRecord.builder()
        .gestureId(gestureId)
        .modelId(result.modelId())
        .predictedLabel(result.predictedLabel())
        .confidence(confidence)
        .probs(result.probs() == null ? null : om.valueToTree(result.probs()))
        .processingTimeMs(result.processingTimeMs())
        .build();

    try {
      boolean matched = mapper.attachInference(update) > 0;
      log.info("[GESTURES][ATTACH_INFERENCE] id={} label={} matched={}", gestureId, result.predictedLabel(), matched);
      return matched;
    } catch (DataAccessException e) {
      log.error("[GESTURES][ATTACH_INFERENCE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Attaching inference", e);
    }
  }

  @Override
  public List<GestureRecord> retrieve(GestureQuery query) {
    GestureQuery q = (query == null) ? GestureQuery.recent() : query;
    if (q.limit() < 1) throw new InvalidRequestException("limit must be positive");
    String userId = (q.userId() == null || q.userId().isBlank()) ? null : q.userId();
    try {
      return mapper.findRecent(userId, q.limit());
    } catch (DataAccessException e) {
      log.error("[GESTURES][RETRIEVE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Listing gestures", e);
    }
  }

  @Override
  public Optional<GestureRecord> findById(long id) {
    try {
      return Optional.ofNullable(mapper.findById(id));
    } catch (DataAccessException e) {
      log.error("[GESTURES][GET] {}", DbErrors.describe(e));
      throw DbErrors.translate("Loading gesture", e);
    }
  }

  @Override
  public boolean update(long id, Map<String, Object> changes) {
    throw new UnsupportedRecordOperationException("PUT /gestures/{id} not implemented");
  }

  @Override
  public boolean delete(long id) {
    try {
      boolean deleted = mapper.deleteById(id) > 0;
      if (deleted) log.info("[GESTURES][DELETE] id={}", id);
      return deleted;
    } catch (DataAccessException e) {
      log.error("[GESTURES][DELETE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Deleting gesture", e);
    }
  }
}
