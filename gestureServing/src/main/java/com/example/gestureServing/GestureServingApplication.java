package com.example.gestureServing;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.gestureServing.config.DatabaseProperties;
import com.example.gestureServing.config.ServingProperties;

@SpringBootApplication(scanBasePackages = "com.example.gestureServing")
@MapperScan("com.example.gestureServing.mapper")
@EnableConfigurationProperties({DatabaseProperties.class, ServingProperties.class})
public class GestureServingApplication {
  public static void main(String[] args) {
    SpringApplication.run(GestureServingApplication.class, args);
  }
}
