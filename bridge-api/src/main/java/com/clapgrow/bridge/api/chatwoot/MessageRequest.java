package com.clapgrow.bridge.api.chatwoot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageRequest {
    private String content;
    @JsonProperty("message_type")
    private String messageType;
    @JsonProperty("private")
    private boolean privateNote;
    @JsonProperty("source_id")
    private String sourceId;
}
