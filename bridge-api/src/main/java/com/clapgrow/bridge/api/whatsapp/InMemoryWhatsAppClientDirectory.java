package com.clapgrow.bridge.api.whatsapp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry the protocol layer fills as tenant sessions connect and disconnect.
 */
@Component
@Slf4j
public class InMemoryWhatsAppClientDirectory implements WhatsAppClientDirectory {

    private final ConcurrentHashMap<String, WhatsAppClient> clients = new ConcurrentHashMap<>();

    public void register(String tenantId, WhatsAppClient client) {
        WhatsAppClient previous = clients.put(tenantId, client);
        log.info("WhatsApp client {} for tenant {}", previous == null ? "registered" : "replaced", tenantId);
    }

    public void unregister(String tenantId) {
        if (clients.remove(tenantId) != null) {
            log.info("WhatsApp client unregistered for tenant {}", tenantId);
        }
    }

    @Override
    public Optional<WhatsAppClient> find(String tenantId) {
        return Optional.ofNullable(clients.get(tenantId));
    }
}
