package com.clapgrow.bridge.api.whatsapp;

import java.util.Optional;

/**
 * Looks up the live WhatsApp client of a tenant.
 */
public interface WhatsAppClientDirectory {

    Optional<WhatsAppClient> find(String tenantId);
}
