package com.clapgrow.bridge.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Maps to:
 * bridge:
 *   queue:
 *     enabled: false
 *     dead-letter-topic: bridge-webhook-errors
 *     events-topic: bridge-whatsapp-events
 */
@Configuration
@ConfigurationProperties(prefix = "bridge.queue")
@Data
public class QueueProperties {

    /**
     * When false no Kafka producer is created and every publish is a no-op.
     */
    private boolean enabled = false;

    private String deadLetterTopic = "bridge-webhook-errors";

    private String eventsTopic = "bridge-whatsapp-events";
}
