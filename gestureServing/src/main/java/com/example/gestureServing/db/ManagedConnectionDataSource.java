package com.example.gestureServing.db;

import java.sql.Connection;
import java.sql.SQLException;

import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import com.example.gestureServing.exception.DatabaseConnectionException;

/**
 * Exposes the {@link ConnectionManager} handle as a {@link javax.sql.DataSource}.
 *
 * Every {@link #getConnection()} returns the managed connection behind Spring's
 * close-suppressing proxy; the manager alone decides when the physical
 * connection goes away.
 */
public class ManagedConnectionDataSource extends SingleConnectionDataSource {

  private final ConnectionManager manager;

  public ManagedConnectionDataSource(ConnectionManager manager) {
    this.manager = manager;
    setSuppressClose(true);
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection target;
    try {
      target = manager.acquire();
    } catch (DatabaseConnectionException e) {
      throw new SQLException(e.getMessage(), "08001", e);
    }
    return getCloseSuppressingConnectionProxy(target);
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    throw new SQLException("Credentials are fixed by the connection manager");
  }
}
