package com.clapgrow.bridge.api.chatwoot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ContactRequest {
    @JsonProperty("inbox_id")
    private long inboxId;
    private String name;
    private String identifier;
    @JsonProperty("phone_number")
    private String phoneNumber; // omitted for groups
    @JsonProperty("avatar_url")
    private String avatarUrl;
}
