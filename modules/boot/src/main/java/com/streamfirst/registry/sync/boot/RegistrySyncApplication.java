package com.streamfirst.registry.sync.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RegistrySyncProperties.class)
public class RegistrySyncApplication {
  public static void main(String[] args) {
    SpringApplication.run(RegistrySyncApplication.class, args);
  }
}
