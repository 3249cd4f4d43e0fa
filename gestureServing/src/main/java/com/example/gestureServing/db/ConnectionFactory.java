package com.example.gestureServing.db;

import java.sql.Connection;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactory {
  Connection open() throws SQLException;
}
