package com.clapgrow.bridge.api.chatwoot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The subset of Chatwoot's {@code message_created} webhook the bridge reads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatwootWebhookPayload {

    public static final String EVENT_MESSAGE_CREATED = "message_created";
    public static final String TYPE_OUTGOING = "outgoing";

    private String event;
    @JsonProperty("message_type")
    private String messageType;
    private long id;
    private String content;
    @JsonProperty("private")
    private boolean privateNote;
    @JsonProperty("content_attributes")
    private Map<String, Object> contentAttributes;
    private Conversation conversation = new Conversation();
    private Inbox inbox = new Inbox();
    private Sender sender = new Sender();

    /**
     * The message of the conversation snapshot that triggered this webhook, if listed.
     */
    public Optional<Message> triggeringMessage() {
        if (conversation == null || conversation.getMessages() == null) {
            return Optional.empty();
        }
        return conversation.getMessages().stream()
            .filter(message -> message.getId() == id)
            .findFirst();
    }

    /**
     * Agent name for message signing: available name first, then name.
     */
    public String agentName() {
        if (sender == null) {
            return null;
        }
        if (sender.getAvailableName() != null && !sender.getAvailableName().isBlank()) {
            return sender.getAvailableName();
        }
        return sender.getName();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Conversation {
        private long id;
        private String status;
        private Meta meta = new Meta();
        private List<Message> messages = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private ContactRef sender = new ContactRef();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContactRef {
        private long id;
        private String identifier;
        @JsonProperty("phone_number")
        private String phoneNumber;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private long id;
        @JsonProperty("source_id")
        private String sourceId;
        private List<Attachment> attachments = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attachment {
        @JsonProperty("data_url")
        private String dataUrl;
        @JsonProperty("file_type")
        private String fileType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Inbox {
        private long id;
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sender {
        private String name;
        @JsonProperty("available_name")
        private String availableName;
    }
}
