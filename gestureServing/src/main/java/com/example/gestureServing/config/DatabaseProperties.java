package com.example.gestureServing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection parameters for the serving database.
 *
 * Bound once at startup (see application.yml, values come from DB_* environment
 * variables) and handed to the connection manager.
 */
@ConfigurationProperties(prefix = "gesture-serving.db")
public class DatabaseProperties {
  private String host = "localhost";
  private int port = 3306;
  private String user;
  private String password;
  private String name;

  // full JDBC url, wins over host/port/name when set
  private String url;

  private int connectTimeoutSeconds = 10;
  private int validationTimeoutSeconds = 2;
  private int statementTimeoutSeconds = 0; // 0 = driver default (none)

  public String getHost() { return host; }
  public void setHost(String host) { this.host = host; }

  public int getPort() { return port; }
  public void setPort(int port) { this.port = port; }

  public String getUser() { return user; }
  public void setUser(String user) { this.user = user; }

  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }

  public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
  public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }

  public int getValidationTimeoutSeconds() { return validationTimeoutSeconds; }
  public void setValidationTimeoutSeconds(int validationTimeoutSeconds) { this.validationTimeoutSeconds = validationTimeoutSeconds; }

  public int getStatementTimeoutSeconds() { return statementTimeoutSeconds; }
  public void setStatementTimeoutSeconds(int statementTimeoutSeconds) { this.statementTimeoutSeconds = statementTimeoutSeconds; }

  /**
   * JDBC url to connect with. Built from host/port/name unless {@code url} is set.
   */
  public String jdbcUrl() {
    if (url != null && !url.isBlank()) return url.trim();
    String db = (name == null) ? "" : name.trim();
    return "jdbc:mysql://" + host + ":" + port + "/" + db;
  }

  /** Host part for log lines, never the password. */
  public String describe() {
    if (url != null && !url.isBlank()) return url.trim();
    return host + ":" + port + "/" + (name == null ? "" : name);
  }
}
