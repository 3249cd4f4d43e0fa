package com.example.gestureServing.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability set shared by the table-backed services.
 *
 * @param <R> row type
 * @param <C> creation fields
 * @param <Q> list query
 */
public interface RecordService<R, C, Q> {

  /** Inserts a row and returns its generated id. */
  long create(C fields);

  /** Rows matching the query; empty when nothing matches, never an error. */
  List<R> retrieve(Q query);

  Optional<R> findById(long id);

  /** Generic partial update. Not supported by any table yet. */
  boolean update(long id, Map<String, Object> changes);

  /** Whether a row was removed. Deleting a missing id is not an error. */
  boolean delete(long id);
}
