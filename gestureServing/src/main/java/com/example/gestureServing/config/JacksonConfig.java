package com.example.gestureServing.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper om = new ObjectMapper();
    om.registerModule(new JavaTimeModule());
    om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    // 15.2 for an integer column (processing_time_ms, latency_ms) is a 400, not a silent 15
    om.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    // wire format is snake_case (gesture_id, predicted_label, ...)
    om.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    return om;
  }
}
