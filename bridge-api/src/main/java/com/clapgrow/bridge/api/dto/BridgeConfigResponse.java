package com.clapgrow.bridge.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Stored Chatwoot configuration as returned to the tenant. {@code token} is always masked.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BridgeConfigResponse {
    private String userId;
    private String accountId;
    private String token;
    private String url;
    private Long inboxId;
    private String nameInbox;
    private Boolean enabled;
    private Boolean autoCreate;
    private Boolean signMsg;
    private String signDelimiter;
    private Boolean reopenConversation;
    private Boolean conversationPending;
    private Boolean mergeBrazilContacts;
    private String organization;
    private String logo;
    /** URL Chatwoot must post agent replies to. */
    private String webhookUrl;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
