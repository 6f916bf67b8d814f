package com.boxline.api.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Entities and repositories live in the infrastructure module. Kept off the application class so
 * web slice tests start without JPA.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.boxline")
@EntityScan(basePackages = "com.boxline")
public class PersistenceConfig {
}
