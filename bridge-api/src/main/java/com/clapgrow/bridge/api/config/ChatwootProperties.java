package com.clapgrow.bridge.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Maps to:
 * bridge:
 *   chatwoot:
 *     public-base-url: https://bridge.example.com
 *     default-inbox-name: WhatsApp Inbox
 *     bot-name: WhatsApp Bot
 *     bot-avatar-url: https://...
 */
@Configuration
@ConfigurationProperties(prefix = "bridge.chatwoot")
@Data
public class ChatwootProperties {

    /**
     * Externally reachable base URL of this service. Chatwoot posts agent
     * replies to {@code <publicBaseUrl>/chatwoot/webhook/<tenant token>}.
     * When blank the base URL of the configuring request is used.
     */
    private String publicBaseUrl = "";

    /**
     * Inbox name used when a configuration request does not provide one.
     */
    private String defaultInboxName = "WhatsApp Inbox";

    /**
     * Bot contact display name when the tenant has no organization set.
     */
    private String botName = "WhatsApp Bot";

    private String botAvatarUrl = "https://raw.githubusercontent.com/chatwoot/chatwoot/develop/public/brand-assets/logo_thumbnail.svg";

    public String webhookUrlFor(String tenantToken, String requestBaseUrl) {
        String base = publicBaseUrl != null && !publicBaseUrl.isBlank() ? publicBaseUrl : requestBaseUrl;
        if (base == null) {
            base = "";
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/chatwoot/webhook/" + tenantToken;
    }
}
