package com.clapgrow.bridge.api.delivery;

import com.clapgrow.bridge.api.config.QueueProperties;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.whatsapp.WhatsAppMessageEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TenantEventDispatcherTest {

    private static final String CHAT = "5511999999999@s.whatsapp.net";

    @Mock
    private WebhookDeliveryService webhookDeliveryService;

    @Mock
    private QueuePublisher queuePublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TenantEventDispatcher dispatcher;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        dispatcher = new TenantEventDispatcher(webhookDeliveryService, queuePublisher, new QueueProperties(),
            objectMapper, Runnable::run);
        tenant = new Tenant();
        tenant.setId("tenant-1");
        tenant.setName("acme");
    }

    @Test
    void testDispatchMessage_WithWebhook_PublishesAndDelivers() throws Exception {
        byte[] key = {1, 2, 3};
        tenant.setWebhookUrl("https://hooks.example.com/wa");
        tenant.setHmacKeyEncrypted(key);

        dispatcher.dispatchMessage(tenant, WhatsAppMessageEvent.text("MSG1", CHAT, "Maria", false, "Hello"));

        ArgumentCaptor<String> queued = ArgumentCaptor.forClass(String.class);
        verify(queuePublisher).publish(eq("bridge-whatsapp-events"), eq("tenant-1"), queued.capture());
        JsonNode event = objectMapper.readTree(queued.getValue());
        assertEquals("Message", event.get("event").asText());
        assertEquals("tenant-1", event.get("userID").asText());
        assertEquals("acme", event.get("instanceName").asText());
        assertEquals("Hello", event.get("data").get("text").asText());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(webhookDeliveryService).deliver(eq("https://hooks.example.com/wa"), payload.capture(),
            eq("tenant-1"), eq(key));
        assertEquals("acme", payload.getValue().get("instanceName"));
        JsonNode jsonData = objectMapper.readTree((String) payload.getValue().get("jsonData"));
        assertEquals("MSG1", jsonData.get("data").get("id").asText());
        assertEquals(CHAT, jsonData.get("data").get("chat").asText());
        assertFalse(jsonData.get("data").get("isGroup").asBoolean());
        assertFalse(jsonData.has("userID"));
    }

    @Test
    void testDispatchMessage_WithoutWebhook_OnlyPublishes() {
        dispatcher.dispatchMessage(tenant, WhatsAppMessageEvent.text("MSG1", CHAT, "Maria", false, "Hello"));

        verify(queuePublisher).publish(eq("bridge-whatsapp-events"), eq("tenant-1"), any());
        verifyNoInteractions(webhookDeliveryService);
    }

    @Test
    void testDispatchMessage_DeliveryThrows_IsContained() {
        tenant.setWebhookUrl("https://hooks.example.com/wa");
        doThrow(new IllegalStateException("boom")).when(webhookDeliveryService)
            .deliver(any(), any(), any(), any());

        assertDoesNotThrow(() ->
            dispatcher.dispatchMessage(tenant, WhatsAppMessageEvent.text("MSG1", CHAT, "Maria", false, "Hello")));
    }
}
