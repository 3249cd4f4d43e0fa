package com.example.gestureServing.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.example.gestureServing.domain.NewPrediction;
import com.example.gestureServing.domain.PredictionCompletion;
import com.example.gestureServing.domain.PredictionQuery;
import com.example.gestureServing.domain.PredictionRecord;
import com.example.gestureServing.domain.PredictionStatus;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.PredictionAlreadyCompletedException;
import com.example.gestureServing.exception.UnsupportedRecordOperationException;
import com.example.gestureServing.mapper.PredictionMapper;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Batch prediction jobs. Inference runs elsewhere; this only tracks
 * queued -> succeeded | failed.
 */
@Slf4j
@Service
public class PredictionDbService implements RecordService<PredictionRecord, NewPrediction, PredictionQuery> {

  private final PredictionMapper mapper;
  private final ObjectMapper om;

  public PredictionDbService(PredictionMapper mapper, ObjectMapper om) {
    this.mapper = mapper;
    this.om = om;
  }

  /** New jobs always start queued; created_at comes from the database clock. */
  @Override
  public long create(NewPrediction fields) {
    PredictionRecord row = PredictionRecord.builder()
        .requestorUserId(fields.requestorUserId())
        .sessionId(fields.sessionId())
        .modelId(fields.modelId())
        .status(PredictionStatus.QUEUED.value())
        .params(om.valueToTree(fields.params() == null ? Map.of() : fields.params()))
        .build();

    try {
      mapper.insert(row);
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][CREATE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Creating prediction", e);
    }

    log.info("[PREDICTIONS][CREATE] id={} session={} model={}", row.getPredictionId(), row.getSessionId(),
        row.getModelId());
    return row.getPredictionId();
  }

  /**
   * Moves a queued prediction to its terminal state. A non-empty error message
   * fails it (output fields untouched); otherwise it succeeds with output_text.
   *
   * @return false when no prediction has this id
   * @throws PredictionAlreadyCompletedException when it already left 'queued'
   */
  public boolean markComplete(long predictionId, PredictionCompletion completion) {
    if (completion == null) throw new InvalidRequestException("completion is required");

    int rows;
    try {
      if (completion.isFailure()) {
        rows = mapper.markFailed(predictionId, completion.errorMessage());
      } else {
        if (completion.outputText() == null) {
          throw new InvalidRequestException("output_text is required when error_message is empty");
        }
        Double c = completion.confidence();
        if (c != null && (c.isNaN() || c < 0.0 || c > 1.0)) {
          throw new InvalidRequestException("confidence must be between 0.0 and 1.0");
        }
        if (completion.latencyMs() != null && completion.latencyMs() < 0) {
          throw new InvalidRequestException("latency_ms must not be negative");
        }
        rows = mapper.markSucceeded(predictionId, completion.outputText(), c, completion.latencyMs());
      }
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][MARK_COMPLETE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Completing prediction", e);
    }

    if (rows > 0) {
      log.info("[PREDICTIONS][MARK_COMPLETE] id={} status={}", predictionId,
          completion.isFailure() ? PredictionStatus.FAILED.value() : PredictionStatus.SUCCEEDED.value());
      return true;
    }

    // nothing matched: either missing or no longer queued
    String current;
    try {
      current = mapper.findStatus(predictionId);
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][MARK_COMPLETE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Completing prediction", e);
    }
    if (current == null) return false;

    log.warn("[PREDICTIONS][MARK_COMPLETE] id={} rejected, status is {}", predictionId, current);
    throw new PredictionAlreadyCompletedException(predictionId, current);
  }

  @Override
  public List<PredictionRecord> retrieve(PredictionQuery query) {
    PredictionQuery q = (query == null) ? PredictionQuery.recent() : query;
    if (q.limit() < 1) throw new InvalidRequestException("limit must be positive");
    try {
      return mapper.findRecent(q.sessionId(), q.limit());
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][RETRIEVE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Listing predictions", e);
    }
  }

  @Override
  public Optional<PredictionRecord> findById(long id) {
    try {
      return Optional.ofNullable(mapper.findById(id));
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][GET] {}", DbErrors.describe(e));
      throw DbErrors.translate("Loading prediction", e);
    }
  }

  @Override
  public boolean update(long id, Map<String, Object> changes) {
    throw new UnsupportedRecordOperationException("PUT /predictions/{id} not implemented");
  }

  @Override
  public boolean delete(long id) {
    try {
      boolean deleted = mapper.deleteById(id) > 0;
      if (deleted) log.info("[PREDICTIONS][DELETE] id={}", id);
      return deleted;
    } catch (DataAccessException e) {
      log.error("[PREDICTIONS][DELETE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Deleting prediction", e);
    }
  }
}
