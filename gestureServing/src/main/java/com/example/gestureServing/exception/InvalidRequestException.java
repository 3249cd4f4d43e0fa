package com.example.gestureServing.exception;

/**
 * Malformed input rejected before anything reaches the database.
 */
public class InvalidRequestException extends ModelServingException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
