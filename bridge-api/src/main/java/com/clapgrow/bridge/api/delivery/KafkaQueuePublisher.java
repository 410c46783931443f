package com.clapgrow.bridge.api.delivery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "bridge.queue", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaQueuePublisher implements QueuePublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publish(String topic, String key, String payload) {
        try {
            kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish {} to Kafka topic {}", key, topic, ex);
                    } else {
                        log.debug("Published {} to Kafka topic {}", key, topic);
                    }
                });
        } catch (RuntimeException e) {
            log.error("Failed to hand {} to the Kafka producer for topic {}", key, topic, e);
        }
    }
}
