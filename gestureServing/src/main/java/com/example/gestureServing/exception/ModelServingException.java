package com.example.gestureServing.exception;

/**
 * Base type for failures raised by the serving layer.
 */
public class ModelServingException extends RuntimeException {

  public ModelServingException(String message) {
    super(message);
  }

  public ModelServingException(String message, Throwable cause) {
    super(message, cause);
  }
}
