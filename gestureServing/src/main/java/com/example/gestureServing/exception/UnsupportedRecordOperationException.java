package com.example.gestureServing.exception;

/**
 * Operation exists on the record API but is not implemented for this table.
 */
public class UnsupportedRecordOperationException extends UnsupportedOperationException {

  public UnsupportedRecordOperationException(String message) {
    super(message);
  }
}
