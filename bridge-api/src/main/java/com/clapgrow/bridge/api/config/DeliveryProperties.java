package com.clapgrow.bridge.api.config;

import com.clapgrow.bridge.api.delivery.DeliveryMode;
import com.clapgrow.bridge.common.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Maps to:
 * bridge:
 *   webhook:
 *     mode: JSON
 *     retry:
 *       enabled: true
 *       count: 3
 *       base-delay: 1s
 */
@Configuration
@ConfigurationProperties(prefix = "bridge.webhook")
@Data
public class DeliveryProperties {

    /**
     * Body encoding for tenant webhooks. Applies to every tenant.
     */
    private DeliveryMode mode = DeliveryMode.JSON;

    private Retry retry = new Retry();

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(retry.isEnabled(), retry.getCount(), retry.getBaseDelay());
    }

    @Data
    public static class Retry {
        private boolean enabled = true;
        private int count = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }
}
