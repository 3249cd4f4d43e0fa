package com.example.gestureServing.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;

import org.apache.ibatis.exceptions.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.MyBatisSystemException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import com.example.gestureServing.exception.DatabaseConnectionException;
import com.example.gestureServing.exception.StorageException;

@DisplayName("DbErrors")
class DbErrorsTest {

  @Test
  @DisplayName("a connect failure buried in the persistence stack comes back as is")
  void unwrapsConnectionFailure() {
    DatabaseConnectionException down =
        new DatabaseConnectionException("Could not connect to database at db:3306/serving", new SQLException("refused"));
    CannotGetJdbcConnectionException wrapped = new CannotGetJdbcConnectionException(
        "Failed to obtain JDBC Connection", new SQLException(down.getMessage(), "08001", down));

    RuntimeException translated = DbErrors.translate("Listing models", wrapped);

    assertThat(translated).isSameAs(down);
  }

  @Test
  @DisplayName("unwraps through MyBatis exceptions too")
  void unwrapsThroughMyBatis() {
    DatabaseConnectionException down =
        new DatabaseConnectionException("Could not connect to database at db:3306/serving", new SQLException("refused"));
    MyBatisSystemException wrapped = new MyBatisSystemException(new PersistenceException("open failed", down));

    assertThat(DbErrors.translate("Storing gesture", wrapped)).isSameAs(down);
  }

  @Test
  @DisplayName("anything else is a StorageException naming the action and the root cause")
  void wrapsStatementFailure() {
    DataIntegrityViolationException failure = new DataIntegrityViolationException(
        "insert failed", new SQLException("Column 'landmarks' cannot be null"));

    RuntimeException translated = DbErrors.translate("Storing gesture", failure);

    assertThat(translated)
        .isInstanceOf(StorageException.class)
        .hasMessage("Storing gesture failed: Column 'landmarks' cannot be null")
        .hasCause(failure);
  }

  @Test
  @DisplayName("describe reaches past wrappers that carry no message")
  void describesRootCause() {
    MyBatisSystemException wrapped = new MyBatisSystemException(
        new PersistenceException(new SQLException("Connection refused")));

    assertThat(wrapped.getMessage()).isNull();
    assertThat(DbErrors.describe(wrapped)).isEqualTo("Connection refused");
  }

  @Test
  @DisplayName("describe falls back to the exception type")
  void describesSilentRoot() {
    assertThat(DbErrors.describe(new IllegalStateException())).isEqualTo("IllegalStateException");
  }
}
