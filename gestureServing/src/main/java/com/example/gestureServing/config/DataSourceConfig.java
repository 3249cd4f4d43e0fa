package com.example.gestureServing.config;

import java.time.Clock;

import javax.sql.DataSource;

import org.mybatis.spring.boot.autoconfigure.ConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.gestureServing.db.ConnectionManager;
import com.example.gestureServing.db.LazyConnectionManager;
import com.example.gestureServing.db.ManagedConnectionDataSource;

import lombok.extern.slf4j.Slf4j;

/**
 * One lazily opened connection for the whole service, exposed to MyBatis as a
 * DataSource. Nothing connects until the first statement runs.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

  @Bean(destroyMethod = "close")
  public ConnectionManager connectionManager(DatabaseProperties props) {
    return new LazyConnectionManager(props);
  }

  @Bean
  public DataSource dataSource(ConnectionManager connectionManager) {
    return new ManagedConnectionDataSource(connectionManager);
  }

  @Bean
  public ConfigurationCustomizer statementTimeoutCustomizer(DatabaseProperties props) {
    return configuration -> {
      if (props.getStatementTimeoutSeconds() > 0) {
        configuration.setDefaultStatementTimeout(props.getStatementTimeoutSeconds());
        log.info("[DB] statement timeout {}s", props.getStatementTimeoutSeconds());
      }
    };
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
