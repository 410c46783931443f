package com.clapgrow.bridge.api.chatwoot;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class InboxRequest {
    private String name;
    private Channel channel = new Channel();

    @Data
    public static class Channel {
        private String type = "api";
        @JsonProperty("webhook_url")
        private String webhookUrl;
    }
}
