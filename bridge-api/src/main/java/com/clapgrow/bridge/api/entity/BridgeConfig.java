package com.clapgrow.bridge.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Per-tenant Chatwoot integration settings. One row per tenant, written only through
 * the configuration API. The API token must never be returned unmasked.
 */
@Entity
@Table(name = "chatwoot_configs", uniqueConstraints = {
    @UniqueConstraint(name = "uk_chatwoot_config_tenant", columnNames = "tenant_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BridgeConfig extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "api_token", nullable = false, length = 255)
    private String apiToken;

    @Column(name = "url", nullable = false, length = 1024)
    private String url;

    /** Set on first auto-provision, or supplied by the tenant. */
    @Column(name = "inbox_id")
    private Long inboxId;

    @Column(name = "name_inbox", length = 255)
    private String inboxName;

    @Column(name = "enabled", nullable = false)
    private Boolean enabled = true;

    @Column(name = "auto_create", nullable = false)
    private Boolean autoCreate = false;

    @Column(name = "sign_msg", nullable = false)
    private Boolean signMessages = false;

    @Column(name = "reopen_conversation", nullable = false)
    private Boolean reopenConversation = false;

    @Column(name = "conversation_pending", nullable = false)
    private Boolean conversationPending = false;

    @Column(name = "merge_brazil_contacts", nullable = false)
    private Boolean mergeBrazilContacts = false;

    @Column(name = "sign_delimiter", length = 32)
    private String signDelimiter;

    @Column(name = "organization", length = 255)
    private String organization;

    @Column(name = "logo", length = 1024)
    private String logo;

    public boolean isActive() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean hasInbox() {
        return inboxId != null && inboxId > 0;
    }
}
