package com.example.gestureServing.exception;

/**
 * Connecting (or reconnecting) to the database failed.
 */
public class DatabaseConnectionException extends ModelServingException {

  public DatabaseConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
