package com.example.gestureServing.exception;

/**
 * A statement failed: constraint violation, bad SQL, lost connection mid-statement.
 */
public class StorageException extends ModelServingException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
