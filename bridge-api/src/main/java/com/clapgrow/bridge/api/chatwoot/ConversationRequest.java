package com.clapgrow.bridge.api.chatwoot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Chatwoot expects the ids as strings on this endpoint.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationRequest {
    @JsonProperty("contact_id")
    private String contactId;
    @JsonProperty("inbox_id")
    private String inboxId;
    private String status;
    @JsonProperty("source_id")
    private String sourceId;
}
