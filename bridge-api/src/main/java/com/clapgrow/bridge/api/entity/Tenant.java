package com.clapgrow.bridge.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Tenant entity.
 *
 * <p>READ-ONLY PROJECTION: the {@code tenants} table is owned by the admin service,
 * which creates tenants, issues their bridge tokens and stores their webhook settings.
 * This service only reads it to authenticate requests and to address webhooks.
 * Do not add write paths here.
 */
@Entity
@Table(name = "tenants", indexes = {
    @Index(name = "idx_tenant_token", columnList = "token")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    /** Instance name, echoed to webhook consumers as {@code instanceName}. */
    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /** Opaque per-tenant token used by the config API and Chatwoot webhook URL. */
    @Column(name = "token", nullable = false, unique = true, length = 255)
    private String token;

    @Column(name = "webhook_url", length = 1024)
    private String webhookUrl;

    /** HMAC signing key sealed by the credential vault; null when signing is off. */
    @Column(name = "hmac_key_encrypted")
    private byte[] hmacKeyEncrypted;

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
