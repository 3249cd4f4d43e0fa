package com.example.gestureServing.service;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;

import com.example.gestureServing.exception.DatabaseConnectionException;
import com.example.gestureServing.exception.StorageException;

/**
 * Maps persistence failures onto the serving error types. A connect failure
 * arrives wrapped by MyBatis and is handed back as the original instance.
 */
final class DbErrors {

  private DbErrors() {}

  static RuntimeException translate(String action, DataAccessException e) {
    Throwable t = e;
    while (t != null) {
      if (t instanceof DatabaseConnectionException) return (DatabaseConnectionException) t;
      if (t.getCause() == t) break;
      t = t.getCause();
    }
    return new StorageException(action + " failed: " + describe(e), e);
  }

  /** Message of the innermost cause; wrapper exceptions often carry none. */
  static String describe(Throwable e) {
    Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
    String message = root.getMessage();
    return message == null ? root.getClass().getSimpleName() : message;
  }
}
