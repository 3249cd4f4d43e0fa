package com.example.gestureServing.exception;

public class RecordNotFoundException extends ModelServingException {

  public RecordNotFoundException(String message) {
    super(message);
  }

  public static RecordNotFoundException of(String kind, long id) {
    return new RecordNotFoundException(kind + " " + id + " not found");
  }
}
