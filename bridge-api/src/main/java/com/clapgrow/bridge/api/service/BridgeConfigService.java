package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.config.ChatwootProperties;
import com.clapgrow.bridge.api.dto.BridgeConfigRequest;
import com.clapgrow.bridge.api.dto.BridgeConfigResponse;
import com.clapgrow.bridge.api.dto.StatusResponse;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.repository.BridgeConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Tenant-facing management of the Chatwoot integration settings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BridgeConfigService {

    /** Stored as typed by users: a backslash followed by 'n'. */
    static final String DEFAULT_SIGN_DELIMITER = "\\n";
    static final String TOKEN_MASK = "****";

    private final BridgeConfigRepository bridgeConfigRepository;
    private final InboxProvisioner inboxProvisioner;
    private final ConversationCache conversationCache;
    private final ChatwootProperties chatwootProperties;

    /**
     * @param requestBaseUrl base URL of the current request, used when no public base URL is configured
     * @throws NotFoundException when the tenant has no configuration
     */
    public BridgeConfigResponse getConfig(Tenant tenant, String requestBaseUrl) {
        BridgeConfig config = bridgeConfigRepository.findByTenantId(tenant.getId())
            .orElseThrow(() -> new NotFoundException("Chatwoot not configured"));
        return toResponse(config, chatwootProperties.webhookUrlFor(tenant.getToken(), requestBaseUrl));
    }

    /**
     * Create or replace the tenant's configuration. With {@code auto_create} and no inbox yet,
     * provisions the inbox before returning.
     *
     * @throws BadRequestException when account id, token or URL is missing
     * @throws BridgeException     when inbox provisioning fails; the configuration stays saved
     */
    public StatusResponse saveConfig(Tenant tenant, BridgeConfigRequest request, String requestBaseUrl) {
        if (isBlank(request.getAccountId()) || isBlank(request.getToken()) || isBlank(request.getUrl())) {
            throw new BadRequestException(BridgeConfigRequest.REQUIRED_FIELDS_MESSAGE);
        }

        BridgeConfig config = bridgeConfigRepository.findByTenantId(tenant.getId()).orElse(null);
        boolean created = config == null;
        if (created) {
            config = new BridgeConfig();
            config.setTenantId(tenant.getId());
        }
        boolean accountChanged = !created
            && (!Objects.equals(config.getAccountId(), request.getAccountId().trim())
                || !Objects.equals(config.getUrl(), request.getUrl().trim()));

        applyRequest(config, request);
        if (accountChanged) {
            // Inbox ids belong to the previous account
            if (request.getInboxId() == null) {
                config.setInboxId(null);
            }
            conversationCache.evictTenant(tenant.getId());
        }
        config = bridgeConfigRepository.save(config);
        log.info("Chatwoot configuration {} for tenant {} (account={}, inbox={})",
            created ? "created" : "updated", tenant.getId(), config.getAccountId(), config.getInboxId());

        if (Boolean.TRUE.equals(config.getAutoCreate()) && !config.hasInbox()) {
            String webhookUrl = chatwootProperties.webhookUrlFor(tenant.getToken(), requestBaseUrl);
            long inboxId = inboxProvisioner.provision(config, webhookUrl);
            config.setInboxId(inboxId);
            config = bridgeConfigRepository.save(config);
            log.info("Provisioned Chatwoot inbox {} for tenant {}", inboxId, tenant.getId());
        }

        return StatusResponse.success("Chatwoot configuration saved successfully",
            config.hasInbox() ? config.getInboxId() : null);
    }

    /**
     * @throws NotFoundException when nothing was deleted
     */
    public StatusResponse deleteConfig(Tenant tenant) {
        long deleted = bridgeConfigRepository.deleteByTenantId(tenant.getId());
        if (deleted == 0) {
            throw new NotFoundException("Configuration not found");
        }
        conversationCache.evictTenant(tenant.getId());
        log.info("Chatwoot configuration deleted for tenant {}", tenant.getId());
        return StatusResponse.success("Chatwoot configuration deleted successfully");
    }

    private void applyRequest(BridgeConfig config, BridgeConfigRequest request) {
        config.setAccountId(request.getAccountId().trim());
        config.setApiToken(request.getToken().trim());
        config.setUrl(request.getUrl().trim());
        if (request.getInboxId() != null && request.getInboxId() > 0) {
            config.setInboxId(request.getInboxId());
        }
        config.setInboxName(isBlank(request.getNameInbox())
            ? chatwootProperties.getDefaultInboxName()
            : request.getNameInbox().trim());
        config.setSignDelimiter(isBlank(request.getSignDelimiter())
            ? DEFAULT_SIGN_DELIMITER
            : request.getSignDelimiter());
        config.setOrganization(request.getOrganization());
        config.setLogo(request.getLogo());

        if (request.getEnabled() != null) {
            config.setEnabled(request.getEnabled());
        }
        if (request.getAutoCreate() != null) {
            config.setAutoCreate(request.getAutoCreate());
        }
        if (request.getSignMsg() != null) {
            config.setSignMessages(request.getSignMsg());
        }
        if (request.getReopenConversation() != null) {
            config.setReopenConversation(request.getReopenConversation());
        }
        if (request.getConversationPending() != null) {
            config.setConversationPending(request.getConversationPending());
        }
        if (request.getMergeBrazilContacts() != null) {
            config.setMergeBrazilContacts(request.getMergeBrazilContacts());
        }
    }

    private BridgeConfigResponse toResponse(BridgeConfig config, String webhookUrl) {
        BridgeConfigResponse response = new BridgeConfigResponse();
        response.setUserId(config.getTenantId());
        response.setAccountId(config.getAccountId());
        response.setToken(maskToken(config.getApiToken()));
        response.setUrl(config.getUrl());
        response.setInboxId(config.getInboxId());
        response.setNameInbox(config.getInboxName());
        response.setEnabled(config.getEnabled());
        response.setAutoCreate(config.getAutoCreate());
        response.setSignMsg(config.getSignMessages());
        response.setSignDelimiter(config.getSignDelimiter());
        response.setReopenConversation(config.getReopenConversation());
        response.setConversationPending(config.getConversationPending());
        response.setMergeBrazilContacts(config.getMergeBrazilContacts());
        response.setOrganization(config.getOrganization());
        response.setLogo(config.getLogo());
        response.setWebhookUrl(webhookUrl);
        response.setCreatedAt(config.getCreatedAt());
        response.setUpdatedAt(config.getUpdatedAt());
        return response;
    }

    /**
     * {@code ****} followed by the last four characters; short tokens are masked entirely.
     */
    static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (token.length() <= 4) {
            return TOKEN_MASK;
        }
        return TOKEN_MASK + token.substring(token.length() - 4);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
