package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.ChatwootClient;
import com.clapgrow.bridge.api.chatwoot.ChatwootClientFactory;
import com.clapgrow.bridge.api.config.ChatwootProperties;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the Chatwoot side of a new integration: an API-channel inbox pointing
 * at the tenant's webhook URL, and the bot contact shown for bridge notices.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboxProvisioner {

    public static final String BOT_IDENTIFIER = "123456";

    private final ChatwootClientFactory chatwootClientFactory;
    private final ChatwootProperties chatwootProperties;

    /**
     * @return id of the created inbox
     * @throws BridgeException when the inbox cannot be created
     */
    public long provision(BridgeConfig config, String webhookUrl) {
        ChatwootClient client = chatwootClientFactory.forConfig(config);

        long inboxId;
        try {
            inboxId = client.createInbox(config.getInboxName(), webhookUrl);
        } catch (RuntimeException e) {
            log.error("Failed to create Chatwoot inbox '{}' for tenant {}: {}",
                config.getInboxName(), config.getTenantId(), e.getMessage());
            throw new BridgeException("Failed to create inbox: " + e.getMessage(), e);
        }

        String botName = isBlank(config.getOrganization()) ? chatwootProperties.getBotName() : config.getOrganization();
        String avatar = isBlank(config.getLogo()) ? chatwootProperties.getBotAvatarUrl() : config.getLogo();
        try {
            long botContactId = client.createContact(inboxId, botName, null, BOT_IDENTIFIER, avatar);
            log.info("Bot contact {} created in inbox {} for tenant {}", botContactId, inboxId, config.getTenantId());
        } catch (RuntimeException e) {
            log.warn("Failed to create bot contact in inbox {} for tenant {}: {}",
                inboxId, config.getTenantId(), e.getMessage());
        }
        return inboxId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
