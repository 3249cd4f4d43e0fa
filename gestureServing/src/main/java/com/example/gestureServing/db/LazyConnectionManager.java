package com.example.gestureServing.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import com.example.gestureServing.config.DatabaseProperties;
import com.example.gestureServing.exception.DatabaseConnectionException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LazyConnectionManager implements ConnectionManager {

  private final ConnectionFactory factory;
  private final String target;
  private final int validationTimeoutSeconds;

  // guarded by this
  private Connection connection;

  public LazyConnectionManager(DatabaseProperties props) {
    this(driverManagerFactory(props), props.describe(), props.getValidationTimeoutSeconds());
  }

  LazyConnectionManager(ConnectionFactory factory, String target, int validationTimeoutSeconds) {
    this.factory = factory;
    this.target = target;
    this.validationTimeoutSeconds = Math.max(0, validationTimeoutSeconds);
  }

  @Override
  public synchronized void connect() {
    if (isAlive(connection)) return;
    dropQuietly();

    log.info("[DB] Connecting to {} ...", target);
    Connection c = null;
    try {
      c = factory.open();
      c.setAutoCommit(true);
      connection = c;
      log.info("[DB] Connected.");
    } catch (SQLException e) {
      connection = c;
      dropQuietly();
      log.warn("[DB] Connection failed: {}", e.getMessage());
      throw new DatabaseConnectionException("Could not connect to database at " + target, e);
    }
  }

  @Override
  public synchronized Connection acquire() {
    if (!isAlive(connection)) {
      if (connection != null) log.info("[DB] Connection lost, reconnecting");
      connect();
    }
    return connection;
  }

  @Override
  public synchronized boolean isConnected() {
    return isAlive(connection);
  }

  @Override
  public synchronized void close() {
    if (connection == null) return;
    try {
      if (!connection.isClosed()) {
        connection.close();
        log.info("[DB] Connection closed.");
      }
    } catch (SQLException e) {
      log.warn("[DB] Error while closing connection: {}", e.getMessage());
    } finally {
      connection = null;
    }
  }

  private boolean isAlive(Connection c) {
    if (c == null) return false;
    try {
      return !c.isClosed() && c.isValid(validationTimeoutSeconds);
    } catch (SQLException e) {
      log.debug("[DB] Validation failed: {}", e.getMessage());
      return false;
    }
  }

  // a dead handle is discarded before reconnecting
  private void dropQuietly() {
    if (connection == null) return;
    try {
      connection.close();
    } catch (SQLException e) {
      log.debug("[DB] Closing stale connection failed: {}", e.getMessage());
    }
    connection = null;
  }

  private static ConnectionFactory driverManagerFactory(DatabaseProperties props) {
    String url = props.jdbcUrl();
    return () -> {
      Properties info = new Properties();
      if (props.getUser() != null) info.setProperty("user", props.getUser());
      if (props.getPassword() != null) info.setProperty("password", props.getPassword());
      if (url.startsWith("jdbc:mysql:") && props.getConnectTimeoutSeconds() > 0) {
        info.setProperty("connectTimeout", String.valueOf(props.getConnectTimeoutSeconds() * 1000));
      }
      return DriverManager.getConnection(url, info);
    };
  }
}
