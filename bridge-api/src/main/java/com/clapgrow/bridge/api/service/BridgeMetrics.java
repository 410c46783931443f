package com.clapgrow.bridge.api.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Bridge and delivery counters, exposed through the actuator metrics endpoint.
 * Counters are registered once at startup and looked up by outcome.
 */
@Service
@RequiredArgsConstructor
public class BridgeMetrics {

    public enum InboundOutcome { FORWARDED, DUPLICATE, FILTERED, INACTIVE, FAILED }

    public enum OutboundOutcome { SENT, IGNORED, FAILED }

    public enum DeliveryOutcome { DELIVERED, FAILED, RETRIED, DEAD_LETTERED }

    private final MeterRegistry meterRegistry;

    private final Map<InboundOutcome, Counter> inboundCounters = new EnumMap<>(InboundOutcome.class);
    private final Map<OutboundOutcome, Counter> outboundCounters = new EnumMap<>(OutboundOutcome.class);
    private final Map<DeliveryOutcome, Counter> deliveryCounters = new EnumMap<>(DeliveryOutcome.class);

    @PostConstruct
    public void init() {
        for (InboundOutcome outcome : InboundOutcome.values()) {
            inboundCounters.put(outcome, Counter.builder("bridge.messages.inbound")
                .description("WhatsApp messages seen by the bridge, by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
        for (OutboundOutcome outcome : OutboundOutcome.values()) {
            outboundCounters.put(outcome, Counter.builder("bridge.messages.outbound")
                .description("Chatwoot webhook calls, by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
        for (DeliveryOutcome outcome : DeliveryOutcome.values()) {
            deliveryCounters.put(outcome, Counter.builder("bridge.webhook.deliveries")
                .description("Tenant webhook delivery attempts and results")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
    }

    public void recordInbound(InboundOutcome outcome) {
        increment(inboundCounters.get(outcome));
    }

    public void recordOutbound(OutboundOutcome outcome) {
        increment(outboundCounters.get(outcome));
    }

    public void recordDelivery(DeliveryOutcome outcome) {
        increment(deliveryCounters.get(outcome));
    }

    private static void increment(Counter counter) {
        // Null before init(), e.g. when constructed directly in a unit test
        if (counter != null) {
            counter.increment();
        }
    }
}
