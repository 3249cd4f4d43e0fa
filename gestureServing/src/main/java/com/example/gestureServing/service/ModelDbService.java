package com.example.gestureServing.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import com.example.gestureServing.domain.ModelQuery;
import com.example.gestureServing.domain.ModelRecord;
import com.example.gestureServing.domain.NewModel;
import com.example.gestureServing.exception.DuplicateModelException;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.UnsupportedRecordOperationException;
import com.example.gestureServing.mapper.ModelMapper;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Model registry: register, list, delete. Registered models are immutable.
 */
@Slf4j
@Service
public class ModelDbService implements RecordService<ModelRecord, NewModel, ModelQuery> {

  private final ModelMapper mapper;
  private final ObjectMapper om;

  public ModelDbService(ModelMapper mapper, ObjectMapper om) {
    this.mapper = mapper;
    this.om = om;
  }

  @Override
  public long create(NewModel fields) {
    requireText(fields.name(), "name");
    requireText(fields.version(), "version");
    requireText(fields.modelType(), "model_type");
    requireText(fields.artifactUri(), "artifact_uri");
    if (fields.inputShape() == null || fields.inputShape().isEmpty()) {
      throw new InvalidRequestException("input_shape is required");
    }
    if (fields.outputShape() == null || fields.outputShape().isEmpty()) {
      throw new InvalidRequestException("output_shape is required");
    }

    String status = (fields.status() == null || fields.status().isBlank())
        ? NewModel.DEFAULT_STATUS : fields.status().trim();

    ModelRecord row = ModelRecord.builder()
        .name(fields.name())
        .version(fields.version())
        .modelType(fields.modelType())
        .artifactUri(fields.artifactUri())
        .inputShape(om.valueToTree(fields.inputShape()))
        .outputShape(om.valueToTree(fields.outputShape()))
        .status(status)
        .metrics(fields.metrics() == null ? null : om.valueToTree(fields.metrics()))
        .sha256(fields.sha256())
        .build();

    try {
      mapper.insert(row);
    } catch (DuplicateKeyException e) {
      log.warn("[MODELS][CREATE] duplicate name={} version={}", fields.name(), fields.version());
      throw new DuplicateModelException(fields.name(), fields.version(), e);
    } catch (DataAccessException e) {
      log.error("[MODELS][CREATE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Registering model", e);
    }

    log.info("[MODELS][CREATE] id={} name={} version={}", row.getModelId(), row.getName(), row.getVersion());
    return row.getModelId();
  }

  @Override
  public List<ModelRecord> retrieve(ModelQuery query) {
    try {
      if (query == null || query.modelId() == null) return mapper.findAll();
      ModelRecord row = mapper.findById(query.modelId());
      return row == null ? List.of() : List.of(row);
    } catch (DataAccessException e) {
      log.error("[MODELS][RETRIEVE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Listing models", e);
    }
  }

  @Override
  public Optional<ModelRecord> findById(long id) {
    return retrieve(ModelQuery.byId(id)).stream().findFirst();
  }

  @Override
  public boolean update(long id, Map<String, Object> changes) {
    throw new UnsupportedRecordOperationException("PUT /models/{id} not implemented");
  }

  @Override
  public boolean delete(long id) {
    try {
      boolean deleted = mapper.deleteById(id) > 0;
      if (deleted) log.info("[MODELS][DELETE] id={}", id);
      return deleted;
    } catch (DataAccessException e) {
      log.error("[MODELS][DELETE] {}", DbErrors.describe(e));
      throw DbErrors.translate("Deleting model", e);
    }
  }

  public int countByStatus(String status) {
    try {
      return mapper.countByStatus(status);
    } catch (DataAccessException e) {
      log.error("[MODELS][COUNT] {}", DbErrors.describe(e));
      throw DbErrors.translate("Counting models", e);
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) throw new InvalidRequestException(field + " is required");
  }
}
