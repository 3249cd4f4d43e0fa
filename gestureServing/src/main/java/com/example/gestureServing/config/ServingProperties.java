package com.example.gestureServing.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gesture-serving")
public class ServingProperties {
  private String serviceName = "Model Serving Microservice";
  private String version = "1.0.0";
  private String description = "A microservice for serving machine learning models for hand gesture recognition";

  private int defaultListLimit = 100;
  private int maxListLimit = 1000;

  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

  public String getServiceName() { return serviceName; }
  public void setServiceName(String serviceName) { this.serviceName = serviceName; }

  public String getVersion() { return version; }
  public void setVersion(String version) { this.version = version; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public int getDefaultListLimit() { return defaultListLimit; }
  public void setDefaultListLimit(int defaultListLimit) { this.defaultListLimit = defaultListLimit; }

  public int getMaxListLimit() { return maxListLimit; }
  public void setMaxListLimit(int maxListLimit) { this.maxListLimit = maxListLimit; }

  public List<String> getAllowedOrigins() { return allowedOrigins; }
  public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
