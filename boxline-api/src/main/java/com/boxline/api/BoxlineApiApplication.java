package com.boxline.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.boxline")
@ConfigurationPropertiesScan(basePackages = "com.boxline")
public class BoxlineApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(BoxlineApiApplication.class, args);
  }
}
