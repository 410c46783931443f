package com.clapgrow.bridge.api.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Kept out of the application class so web slice tests do not need a JPA context.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
