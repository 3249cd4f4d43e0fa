package com.example.gestureServing.controller;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.example.gestureServing.dto.ErrorResponse;
import com.example.gestureServing.exception.DatabaseConnectionException;
import com.example.gestureServing.exception.DuplicateModelException;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.PredictionAlreadyCompletedException;
import com.example.gestureServing.exception.RecordNotFoundException;
import com.example.gestureServing.exception.StorageException;
import com.example.gestureServing.exception.UnsupportedRecordOperationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps the serving error types onto HTTP statuses. Every error body carries a
 * readable message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  private final Clock clock;

  public GlobalExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(RecordNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException ex, HttpServletRequest req) {
    log.debug("Not found: {}", ex.getMessage());
    return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), req, null);
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex, HttpServletRequest req) {
    log.warn("Invalid request {}: {}", req.getRequestURI(), ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), req, null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      errors.putIfAbsent(toWireName(fe.getField()), fe.getDefaultMessage());
    }
    String message = errors.isEmpty() ? "Invalid input" : errors.values().iterator().next();
    log.warn("Validation failed {}: {}", req.getRequestURI(), errors);
    return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, req, errors);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
    log.warn("Unreadable body {}: {}", req.getRequestURI(), ex.getMostSpecificCause().getMessage());
    return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body is missing or not valid JSON", req, null);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest req) {
    String message = "Invalid value '" + ex.getValue() + "' for " + ex.getName();
    return build(HttpStatus.BAD_REQUEST, "Invalid Request", message, req, null);
  }

  @ExceptionHandler(UnsupportedRecordOperationException.class)
  public ResponseEntity<ErrorResponse> handleUnsupported(UnsupportedRecordOperationException ex, HttpServletRequest req) {
    return build(HttpStatus.NOT_IMPLEMENTED, "Not Implemented", "NOT IMPLEMENTED: " + ex.getMessage(), req, null);
  }

  @ExceptionHandler(PredictionAlreadyCompletedException.class)
  public ResponseEntity<ErrorResponse> handleAlreadyCompleted(PredictionAlreadyCompletedException ex,
                                                              HttpServletRequest req) {
    return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), req, null);
  }

  @ExceptionHandler(DuplicateModelException.class)
  public ResponseEntity<ErrorResponse> handleDuplicateModel(DuplicateModelException ex, HttpServletRequest req) {
    return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), req, null);
  }

  @ExceptionHandler(DatabaseConnectionException.class)
  public ResponseEntity<ErrorResponse> handleConnection(DatabaseConnectionException ex, HttpServletRequest req) {
    log.error("Database unavailable for {}: {}", req.getRequestURI(), ex.getMessage());
    return build(HttpStatus.SERVICE_UNAVAILABLE, "Database Unavailable", ex.getMessage(), req, null);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ErrorResponse> handleStorage(StorageException ex, HttpServletRequest req) {
    log.error("Storage failure for {}", req.getRequestURI(), ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", ex.getMessage(), req, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest req) {
    // framework errors (unknown path, wrong method, missing param) keep their own status
    if (ex instanceof org.springframework.web.ErrorResponse) {
      HttpStatusCode code = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
      HttpStatus status = HttpStatus.resolve(code.value());
      if (status != null && status.is4xxClientError()) {
        log.debug("Client error for {}: {}", req.getRequestURI(), ex.getMessage());
        return build(status, status.getReasonPhrase(), ex.getMessage(), req, null);
      }
    }
    log.error("Unexpected error for {}", req.getRequestURI(), ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", req, null);
  }

  private static String toWireName(String field) {
    // landmarks[3] -> landmarks[3], frameWidth -> frame_width
    int bracket = field.indexOf('[');
    if (bracket < 0) return SNAKE.translate(field);
    return SNAKE.translate(field.substring(0, bracket)) + field.substring(bracket);
  }

  private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                              HttpServletRequest req, Map<String, String> validationErrors) {
    ErrorResponse body = ErrorResponse.builder()
        .timestamp(Instant.now(clock))
        .status(status.value())
        .error(error)
        .message(message)
        .path(req.getRequestURI())
        .validationErrors(validationErrors)
        .build();
    return ResponseEntity.status(status).body(body);
  }
}
