package com.clapgrow.bridge.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Maps to:
 * bridge:
 *   dedup:
 *     ttl: PT30M
 *     purge-interval: PT10M
 */
@Configuration
@ConfigurationProperties(prefix = "bridge.dedup")
@Data
public class DedupProperties {

    /**
     * A message id younger than this is treated as already processed.
     */
    private Duration ttl = Duration.ofMinutes(30);

    /**
     * Interval between purges of expired ids. Read by the scheduler via
     * {@code bridge.dedup.purge-interval}.
     */
    private Duration purgeInterval = Duration.ofMinutes(10);
}
