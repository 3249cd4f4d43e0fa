package com.example.gestureServing.exception;

public class DuplicateModelException extends StorageException {

  public DuplicateModelException(String name, String version, Throwable cause) {
    super("Model " + name + " " + version + " is already registered", cause);
  }
}
