package com.clapgrow.bridge.api.whatsapp;

import com.clapgrow.bridge.api.delivery.TenantEventDispatcher;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.service.BridgeCancelledException;
import com.clapgrow.bridge.api.service.BridgeService;
import com.clapgrow.bridge.api.service.TenantService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Entry point for the protocol layer: one call per message on a tenant's event stream.
 * Each event becomes one task on the bridge pool; failures are logged, never rethrown.
 */
@Component
@Slf4j
public class WhatsAppEventRouter {

    private final BridgeService bridgeService;
    private final TenantEventDispatcher tenantEventDispatcher;
    private final TenantService tenantService;
    private final WhatsAppClientDirectory whatsAppClientDirectory;
    private final TaskExecutor bridgeExecutor;

    public WhatsAppEventRouter(BridgeService bridgeService,
                               TenantEventDispatcher tenantEventDispatcher,
                               TenantService tenantService,
                               WhatsAppClientDirectory whatsAppClientDirectory,
                               @Qualifier("bridgeExecutor") TaskExecutor bridgeExecutor) {
        this.bridgeService = bridgeService;
        this.tenantEventDispatcher = tenantEventDispatcher;
        this.tenantService = tenantService;
        this.whatsAppClientDirectory = whatsAppClientDirectory;
        this.bridgeExecutor = bridgeExecutor;
    }

    public void onMessage(String tenantId, WhatsAppMessageEvent event) {
        bridgeExecutor.execute(() -> route(tenantId, event));
    }

    void route(String tenantId, WhatsAppMessageEvent event) {
        WhatsAppClient client = whatsAppClientDirectory.find(tenantId).orElse(null);
        try {
            bridgeService.handleIncomingMessage(tenantId, event, client);
        } catch (BridgeCancelledException e) {
            log.warn("Bridge handling of message {} for tenant {} cancelled", event.messageId(), tenantId);
        } catch (RuntimeException e) {
            log.error("Failed to bridge message {} from {} for tenant {}: {}",
                event.messageId(), event.chatJid(), tenantId, e.getMessage(), e);
        }

        Optional<Tenant> tenant = tenantService.findById(tenantId);
        if (tenant.isEmpty()) {
            log.warn("Unknown tenant {} - message {} not dispatched", tenantId, event.messageId());
            return;
        }
        try {
            tenantEventDispatcher.dispatchMessage(tenant.get(), event);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch message {} for tenant {}", event.messageId(), tenantId, e);
        }
    }
}
