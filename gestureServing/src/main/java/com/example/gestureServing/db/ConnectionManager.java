package com.example.gestureServing.db;

import java.sql.Connection;

import com.example.gestureServing.exception.DatabaseConnectionException;

/**
 * Owns a single database connection.
 *
 * No pooling and no transactions: the handle runs in autocommit and is
 * re-established on demand when it is missing or dead.
 */
public interface ConnectionManager extends AutoCloseable {

  /**
   * Opens the connection if none is held (or the held one is dead).
   *
   * @throws DatabaseConnectionException when the driver refuses to connect
   */
  void connect();

  /**
   * Returns a live connection, reconnecting first if needed.
   *
   * @throws DatabaseConnectionException when reconnecting fails
   */
  Connection acquire();

  /** Whether a live connection is currently held. Never connects. */
  boolean isConnected();

  /** Releases the connection. Calling it again is a no-op. */
  @Override
  void close();
}
