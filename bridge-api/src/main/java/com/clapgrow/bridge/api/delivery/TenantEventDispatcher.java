package com.clapgrow.bridge.api.delivery;

import com.clapgrow.bridge.api.config.QueueProperties;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.whatsapp.WhatsAppMessageEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends WhatsApp-originated events out of the bridge: to the shared events topic and,
 * when the tenant has one, to its webhook. Webhook deliveries run on the delivery pool.
 */
@Component
@Slf4j
public class TenantEventDispatcher {

    static final String MESSAGE_EVENT = "Message";

    private final WebhookDeliveryService webhookDeliveryService;
    private final QueuePublisher queuePublisher;
    private final QueueProperties queueProperties;
    private final ObjectMapper objectMapper;
    private final TaskExecutor deliveryExecutor;

    public TenantEventDispatcher(WebhookDeliveryService webhookDeliveryService,
                                 QueuePublisher queuePublisher,
                                 QueueProperties queueProperties,
                                 ObjectMapper objectMapper,
                                 @Qualifier("deliveryExecutor") TaskExecutor deliveryExecutor) {
        this.webhookDeliveryService = webhookDeliveryService;
        this.queuePublisher = queuePublisher;
        this.queueProperties = queueProperties;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
    }

    public void dispatchMessage(Tenant tenant, WhatsAppMessageEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", MESSAGE_EVENT);
        envelope.put("data", messageData(event));

        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise event {} for tenant {}", event.messageId(), tenant.getId(), e);
            return;
        }

        publishToQueue(tenant, envelope, event.messageId());

        if (!tenant.hasWebhook()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(WebhookDeliveryService.JSON_DATA_KEY, json);
        payload.put(WebhookDeliveryService.INSTANCE_NAME_KEY, tenant.getName());

        String url = tenant.getWebhookUrl();
        byte[] hmacKey = tenant.getHmacKeyEncrypted();
        deliveryExecutor.execute(() -> {
            try {
                webhookDeliveryService.deliver(url, payload, tenant.getId(), hmacKey);
            } catch (RuntimeException e) {
                log.error("Webhook delivery of {} to {} for tenant {} aborted", event.messageId(), url, tenant.getId(), e);
            }
        });
    }

    private void publishToQueue(Tenant tenant, Map<String, Object> envelope, String messageId) {
        Map<String, Object> enriched = new LinkedHashMap<>(envelope);
        enriched.put(WebhookDeliveryService.USER_ID_KEY, tenant.getId());
        enriched.put(WebhookDeliveryService.INSTANCE_NAME_KEY, tenant.getName());
        try {
            queuePublisher.publish(queueProperties.getEventsTopic(), tenant.getId(), objectMapper.writeValueAsString(enriched));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise queue event {} for tenant {}", messageId, tenant.getId(), e);
        }
    }

    private static Map<String, Object> messageData(WhatsAppMessageEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", event.messageId());
        data.put("chat", event.chatJid());
        data.put("sender", event.senderJid());
        data.put("isGroup", event.group());
        data.put("fromMe", event.fromMe());
        data.put("pushName", event.pushName());
        data.put("type", event.kind() != null ? event.kind().name().toLowerCase() : null);
        if (event.hasText()) {
            data.put("text", event.text());
        }
        if (event.caption() != null) {
            data.put("caption", event.caption());
        }
        if (event.mimeType() != null) {
            data.put("mimeType", event.mimeType());
        }
        if (event.fileName() != null) {
            data.put("fileName", event.fileName());
        }
        data.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : null);
        return data;
    }
}
