package com.clapgrow.bridge.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body of {@code PUT /api/v1/chatwoot/config}. Fields are snake_case on the wire.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BridgeConfigRequest {

    public static final String REQUIRED_FIELDS_MESSAGE = "account_id, token, and url are required";

    @NotBlank(message = REQUIRED_FIELDS_MESSAGE)
    private String accountId;

    /** Chatwoot API access token. */
    @NotBlank(message = REQUIRED_FIELDS_MESSAGE)
    private String token;

    /** Chatwoot base URL, e.g. https://app.chatwoot.com */
    @NotBlank(message = REQUIRED_FIELDS_MESSAGE)
    private String url;

    /** Existing inbox to use; skips auto-provisioning when set. */
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
}
