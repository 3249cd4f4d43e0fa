package com.example.gestureServing.exception;

public class PredictionAlreadyCompletedException extends ModelServingException {

  public PredictionAlreadyCompletedException(long predictionId, String status) {
    super("Prediction " + predictionId + " is already " + status);
  }
}
