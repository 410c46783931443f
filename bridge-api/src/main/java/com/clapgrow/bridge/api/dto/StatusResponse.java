package com.clapgrow.bridge.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
    String status,
    String message,
    @JsonProperty("inbox_id") Long inboxId
) {
    public static StatusResponse success(String message) {
        return new StatusResponse("success", message, null);
    }

    public static StatusResponse success(String message, Long inboxId) {
        return new StatusResponse("success", message, inboxId);
    }
}
