package com.clapgrow.bridge.api.delivery;

import com.clapgrow.bridge.api.config.QueueProperties;
import com.clapgrow.bridge.api.service.BridgeMetrics;
import com.clapgrow.bridge.api.service.BridgeMetrics.DeliveryOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort hand-off of failed deliveries to the dead-letter topic. Never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterPublisher {

    private final QueuePublisher queuePublisher;
    private final QueueProperties queueProperties;
    private final ObjectMapper objectMapper;
    private final BridgeMetrics bridgeMetrics;

    public void publish(DeadLetterRecord record) {
        try {
            String json = objectMapper.writeValueAsString(record);
            queuePublisher.publish(queueProperties.getDeadLetterTopic(), record.getUserId(), json);
            bridgeMetrics.recordDelivery(DeliveryOutcome.DEAD_LETTERED);
            log.info("Dead-lettered webhook delivery to {} for tenant {}", record.getUrl(), record.getUserId());
        } catch (Exception e) {
            log.error("Failed to dead-letter webhook delivery to {} for tenant {}: {}",
                record.getUrl(), record.getUserId(), record.getErrorMessage(), e);
        }
    }
}
