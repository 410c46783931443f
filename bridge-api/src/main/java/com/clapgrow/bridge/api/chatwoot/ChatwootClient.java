package com.clapgrow.bridge.api.chatwoot;

import com.clapgrow.bridge.common.phone.PhoneNumbers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocking client for one Chatwoot account. Instances are bound to a tenant's base URL,
 * account id and API token by {@link ChatwootClientFactory}; every call is bounded by
 * the configured timeout.
 */
@Slf4j
public class ChatwootClient {

    public static final String AUTH_HEADER = "api_access_token";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String accountId;
    private final Duration timeout;

    public ChatwootClient(WebClient webClient, ObjectMapper objectMapper, String accountId, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.accountId = accountId;
        this.timeout = timeout;
    }

    /**
     * Create an API-channel inbox whose agent replies are posted to {@code webhookUrl}.
     *
     * @return the new inbox id
     */
    public long createInbox(String name, String webhookUrl) {
        InboxRequest request = new InboxRequest();
        request.setName(name);
        request.getChannel().setWebhookUrl(webhookUrl);

        JsonNode response = postJson("/api/v1/accounts/{account}/inboxes", request, accountId);
        long inboxId = response.path("id").asLong();
        log.info("Chatwoot inbox created: id={}, name={}", inboxId, name);
        return inboxId;
    }

    /**
     * Search contacts by phone number. A number without a leading '+' gets one.
     *
     * @return id of the first match, or empty when nothing matched
     */
    public Optional<Long> findContactByPhone(String phone) {
        String query = phone.startsWith("+") ? phone : "+" + phone;
        JsonNode response = exchange(HttpMethod.GET,
            "/api/v1/accounts/{account}/contacts/search?q={q}", null, accountId, query);

        JsonNode payload = response.path("payload");
        if (!payload.isArray() || payload.isEmpty()) {
            return Optional.empty();
        }
        long contactId = payload.get(0).path("id").asLong();
        log.debug("Chatwoot contact found: id={}, phone={}", contactId, query);
        return Optional.of(contactId);
    }

    /**
     * Create a contact in the given inbox. {@code phone} is only sent for non-group addresses.
     *
     * @return the new contact id
     */
    public long createContact(long inboxId, String name, String phone, String identifier, String avatarUrl) {
        ContactRequest request = new ContactRequest();
        request.setInboxId(inboxId);
        request.setName(name);
        request.setIdentifier(identifier);
        request.setAvatarUrl(avatarUrl);
        if (phone != null && !phone.isEmpty() && !phone.contains("@" + PhoneNumbers.GROUP_SERVER)) {
            request.setPhoneNumber(phone.startsWith("+") ? phone : "+" + phone);
        }

        JsonNode response = postJson("/api/v1/accounts/{account}/contacts", request, accountId);
        long contactId = response.path("payload").path("contact").path("id").asLong();
        log.info("Chatwoot contact created: id={}, name={}", contactId, name);
        return contactId;
    }

    /**
     * @param pending open the conversation in "pending" status instead of Chatwoot's default
     * @return the new conversation id
     */
    public long createConversation(long contactId, long inboxId, String sourceId, boolean pending) {
        ConversationRequest request = new ConversationRequest();
        request.setContactId(String.valueOf(contactId));
        request.setInboxId(String.valueOf(inboxId));
        request.setSourceId(sourceId);
        if (pending) {
            request.setStatus("pending");
        }

        JsonNode response = postJson("/api/v1/accounts/{account}/conversations", request, accountId);
        long conversationId = response.path("id").asLong();
        log.info("Chatwoot conversation created: id={}, contactId={}, inboxId={}",
            conversationId, contactId, inboxId);
        return conversationId;
    }

    /**
     * @return the new message id
     */
    public long createMessage(long conversationId, String messageType, String content,
                              boolean privateNote, String sourceId) {
        MessageRequest request = new MessageRequest();
        request.setContent(content);
        request.setMessageType(messageType);
        request.setPrivateNote(privateNote);
        request.setSourceId(sourceId);

        JsonNode response = postJson("/api/v1/accounts/{account}/conversations/{conversation}/messages",
            request, accountId, conversationId);
        long messageId = response.path("id").asLong();
        log.debug("Chatwoot message created: id={}, conversationId={}, type={}",
            messageId, conversationId, messageType);
        return messageId;
    }

    /**
     * Upload a message with one file attachment as multipart/form-data.
     *
     * @param caption message text; omitted when blank
     * @return the new message id
     */
    public long sendMediaMessage(long conversationId, String messageType, MediaAttachment attachment,
                                 String caption, String sourceId) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("message_type", messageType);
        if (caption != null && !caption.isEmpty()) {
            builder.part("content", caption);
        }
        if (sourceId != null && !sourceId.isEmpty()) {
            builder.part("source_id", sourceId);
        }
        builder.part("attachments[]", new ByteArrayResource(attachment.data()))
            .filename(attachment.fileName())
            .contentType(resolveMediaType(attachment.mimeType()));

        log.debug("Sending media to Chatwoot: conversationId={}, file={}, mimeType={}, size={}",
            conversationId, attachment.fileName(), attachment.mimeType(), attachment.data().length);

        JsonNode response = exchange(HttpMethod.POST,
            "/api/v1/accounts/{account}/conversations/{conversation}/messages",
            BodyInserters.fromMultipartData(builder.build()), accountId, conversationId);
        long messageId = response.path("id").asLong();
        log.info("Chatwoot media message sent: id={}, conversationId={}, file={}",
            messageId, conversationId, attachment.fileName());
        return messageId;
    }

    private JsonNode postJson(String path, Object body, Object... uriVariables) {
        return exchange(HttpMethod.POST, path, BodyInserters.fromValue(body), uriVariables);
    }

    private JsonNode exchange(HttpMethod method, String path,
                              BodyInserter<?, ? super ClientHttpRequest> body, Object... uriVariables) {
        WebClient.RequestBodySpec spec = webClient.method(method).uri(path, uriVariables);
        WebClient.RequestHeadersSpec<?> request = body != null ? spec.body(body) : spec;

        RawResponse raw;
        try {
            raw = request
                .exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(text -> new RawResponse(response.statusCode().value(), text)))
                .block(timeout);
        } catch (RuntimeException e) {
            throw new ChatwootApiException("Chatwoot request failed: " + method + " " + path + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ChatwootApiException("Chatwoot request returned no response: " + method + " " + path, null);
        }
        if (raw.status() < 200 || raw.status() >= 300) {
            throw new ChatwootApiException(raw.status(), errorMessage(raw.body()));
        }
        return parse(raw.body());
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ChatwootApiException("Failed to decode Chatwoot response", e);
        }
    }

    /**
     * Chatwoot error bodies carry a "message" field; fall back to the raw body.
     */
    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode message = node.path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static MediaType resolveMediaType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (IllegalArgumentException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private record RawResponse(int status, String body) {
    }
}
