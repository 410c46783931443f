package com.clapgrow.bridge.api.delivery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when {@code bridge.queue.enabled} is false or unset.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.queue", name = "enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class NoopQueuePublisher implements QueuePublisher {

    @Override
    public void publish(String topic, String key, String payload) {
        log.debug("Queue disabled - dropping message {} for topic {}", key, topic);
    }
}
