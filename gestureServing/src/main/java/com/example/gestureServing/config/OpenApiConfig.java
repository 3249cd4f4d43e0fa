package com.example.gestureServing.config;

import java.util.List;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API docs at /swagger-ui.html, raw OpenAPI document at /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

  @Bean
  public OpenAPI servingOpenApi(ServingProperties props) {
    return new OpenAPI()
        .info(new Info()
            .title(props.getServiceName())
            .version(props.getVersion())
            .description(props.getDescription()))
        .tags(List.of(
            new Tag().name("gestures").description("Operations for gesture recognition and results management"),
            new Tag().name("models").description("Operations for ML model management and registration"),
            new Tag().name("predictions").description("Operations for batch prediction requests and processing"),
            new Tag().name("health").description("Health check and system status endpoints")));
  }
}
