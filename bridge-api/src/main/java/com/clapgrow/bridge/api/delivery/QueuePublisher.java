package com.clapgrow.bridge.api.delivery;

/**
 * Fire-and-forget publish to a named topic.
 */
public interface QueuePublisher {

    /**
     * Must not throw for broker failures; implementations log them.
     */
    void publish(String topic, String key, String payload);
}
