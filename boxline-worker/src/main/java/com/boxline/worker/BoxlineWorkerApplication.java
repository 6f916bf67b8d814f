package com.boxline.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.boxline")
@ConfigurationPropertiesScan(basePackages = "com.boxline")
@EnableScheduling
public class BoxlineWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoxlineWorkerApplication.class, args);
    }
}
