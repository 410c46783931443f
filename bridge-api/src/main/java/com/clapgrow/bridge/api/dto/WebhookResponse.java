package com.clapgrow.bridge.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body returned to Chatwoot for an accepted webhook call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(
    String status,
    String reason
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_IGNORED = "ignored";

    public static WebhookResponse success() {
        return new WebhookResponse(STATUS_SUCCESS, null);
    }

    public static WebhookResponse ignored(String reason) {
        return new WebhookResponse(STATUS_IGNORED, reason);
    }
}
