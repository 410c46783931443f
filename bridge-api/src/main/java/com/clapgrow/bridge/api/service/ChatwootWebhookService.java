package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.AttachmentDownloader;
import com.clapgrow.bridge.api.chatwoot.AttachmentDownloader.DownloadedAttachment;
import com.clapgrow.bridge.api.chatwoot.ChatwootWebhookPayload;
import com.clapgrow.bridge.api.chatwoot.ChatwootWebhookPayload.Attachment;
import com.clapgrow.bridge.api.chatwoot.ChatwootWebhookPayload.ContactRef;
import com.clapgrow.bridge.api.chatwoot.ChatwootWebhookPayload.Message;
import com.clapgrow.bridge.api.dto.WebhookResponse;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.repository.BridgeConfigRepository;
import com.clapgrow.bridge.api.service.BridgeMetrics.OutboundOutcome;
import com.clapgrow.bridge.api.whatsapp.MessageKind;
import com.clapgrow.bridge.api.whatsapp.OutgoingMessage;
import com.clapgrow.bridge.api.whatsapp.WhatsAppClient;
import com.clapgrow.bridge.api.whatsapp.WhatsAppClientDirectory;
import com.clapgrow.bridge.common.phone.PhoneNumbers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Sends Chatwoot agent replies to WhatsApp.
 *
 * <p>The send is synchronous: the webhook call only succeeds once WhatsApp acknowledged
 * every message, so Chatwoot sees delivery failures as non-2xx responses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatwootWebhookService {

    static final String REASON_NOT_MESSAGE_CREATED = "not message_created";
    static final String REASON_NOT_OUTGOING = "not outgoing";
    static final String REASON_PRIVATE_NOTE = "private note";
    static final String REASON_LOOP_PREVENTION = "loop prevention";
    static final String DEFAULT_SIGN_DELIMITER = "\n";

    private final TenantService tenantService;
    private final BridgeConfigRepository bridgeConfigRepository;
    private final ConversationCache conversationCache;
    private final WhatsAppClientDirectory whatsAppClientDirectory;
    private final AttachmentDownloader attachmentDownloader;
    private final DedupGuard dedupGuard;
    private final BridgeMetrics bridgeMetrics;
    private final ObjectMapper objectMapper;

    /**
     * @param tenantToken the bridge's per-tenant token from the webhook URL
     * @param rawBody     Chatwoot webhook body
     * @throws UnauthorizedException       missing or unknown token
     * @throws BadRequestException         unparseable body or no destination
     * @throws ServiceUnavailableException the tenant's WhatsApp session is not usable
     * @throws BridgeException             the WhatsApp send failed
     */
    public WebhookResponse handleOutgoingWebhook(String tenantToken, String rawBody) {
        Tenant tenant = tenantService.resolveByToken(tenantToken);
        String tenantId = tenant.getId();

        ChatwootWebhookPayload payload = parse(rawBody);

        Optional<String> ignoreReason = ignoreReason(payload);
        if (ignoreReason.isPresent()) {
            log.debug("Ignoring Chatwoot webhook for tenant {}: {} (event={}, messageId={})",
                tenantId, ignoreReason.get(), payload.getEvent(), payload.getId());
            bridgeMetrics.recordOutbound(OutboundOutcome.IGNORED);
            return WebhookResponse.ignored(ignoreReason.get());
        }

        ContactRef contact = senderOf(payload);
        String destination = resolveDestination(contact);
        if (destination == null) {
            log.warn("Chatwoot webhook for tenant {} has no destination (conversation={})",
                tenantId, payload.getConversation() != null ? payload.getConversation().getId() : null);
            throw new BadRequestException("no destination");
        }
        String recipientJid = destination.contains("@") ? destination : PhoneNumbers.userJid(destination);

        storeConversation(tenantId, recipientJid, contact, payload);

        WhatsAppClient whatsAppClient = requireUsableClient(tenantId);

        String content = applySignature(tenantId, payload);
        List<Attachment> attachments = payload.triggeringMessage()
            .map(Message::getAttachments)
            .orElse(List.of());

        if (attachments != null && !attachments.isEmpty()) {
            for (Attachment attachment : attachments) {
                sendAttachment(tenantId, whatsAppClient, recipientJid, attachment, content);
            }
        } else if (content != null && !content.isEmpty()) {
            sendText(tenantId, whatsAppClient, recipientJid, content);
        } else {
            log.debug("Chatwoot message {} for tenant {} has neither content nor attachments", payload.getId(), tenantId);
        }

        bridgeMetrics.recordOutbound(OutboundOutcome.SENT);
        return WebhookResponse.success();
    }

    private ChatwootWebhookPayload parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new BadRequestException("invalid payload");
        }
        try {
            ChatwootWebhookPayload payload = objectMapper.readValue(rawBody, ChatwootWebhookPayload.class);
            if (payload == null) {
                throw new BadRequestException("invalid payload");
            }
            return payload;
        } catch (JsonProcessingException e) {
            log.warn("Unparseable Chatwoot webhook body: {}", e.getOriginalMessage());
            throw new BadRequestException("invalid payload");
        }
    }

    static Optional<String> ignoreReason(ChatwootWebhookPayload payload) {
        if (!ChatwootWebhookPayload.EVENT_MESSAGE_CREATED.equals(payload.getEvent())) {
            return Optional.of(REASON_NOT_MESSAGE_CREATED);
        }
        if (!ChatwootWebhookPayload.TYPE_OUTGOING.equals(payload.getMessageType())) {
            return Optional.of(REASON_NOT_OUTGOING);
        }
        if (payload.isPrivateNote()) {
            return Optional.of(REASON_PRIVATE_NOTE);
        }
        if (isEcho(payload)) {
            return Optional.of(REASON_LOOP_PREVENTION);
        }
        return Optional.empty();
    }

    /**
     * A message the bridge created itself: the lead message carries the bridge's source prefix
     * and is the message this webhook reports.
     */
    static boolean isEcho(ChatwootWebhookPayload payload) {
        List<Message> messages = payload.getConversation() != null ? payload.getConversation().getMessages() : null;
        if (messages == null || messages.isEmpty()) {
            return false;
        }
        Message first = messages.get(0);
        return first.getSourceId() != null
            && first.getSourceId().startsWith(BridgeService.MESSAGE_SOURCE_PREFIX)
            && first.getId() == payload.getId();
    }

    /**
     * @return null when the payload carries no conversation or no sender metadata
     */
    static ContactRef senderOf(ChatwootWebhookPayload payload) {
        if (payload.getConversation() == null || payload.getConversation().getMeta() == null) {
            return null;
        }
        return payload.getConversation().getMeta().getSender();
    }

    /**
     * Contact identifier first (local part of a user JID, group JIDs kept whole), then the phone
     * number without its leading '+'.
     *
     * @return null when the contact carries neither
     */
    static String resolveDestination(ContactRef contact) {
        if (contact == null) {
            return null;
        }
        String identifier = contact.getIdentifier();
        if (identifier != null && !identifier.isBlank()) {
            if (PhoneNumbers.isGroup(identifier)) {
                return identifier;
            }
            return PhoneNumbers.localPart(identifier);
        }
        String phone = contact.getPhoneNumber();
        if (phone != null && !phone.isBlank()) {
            String trimmed = phone.startsWith("+") ? phone.substring(1) : phone;
            return trimmed.isBlank() ? null : trimmed;
        }
        return null;
    }

    private void storeConversation(String tenantId, String recipientJid, ContactRef contact,
                                   ChatwootWebhookPayload payload) {
        long conversationId = payload.getConversation().getId();
        if (conversationId <= 0) {
            return;
        }
        long contactId = contact.getId();
        long inboxId = payload.getInbox() != null ? payload.getInbox().getId() : 0L;
        try {
            conversationCache.storeFromWebhook(tenantId, recipientJid, conversationId, contactId, inboxId);
        } catch (RuntimeException e) {
            log.warn("Failed to store conversation {} for {} (tenant={}): {}",
                conversationId, recipientJid, tenantId, e.getMessage());
        }
    }

    private WhatsAppClient requireUsableClient(String tenantId) {
        WhatsAppClient client = whatsAppClientDirectory.find(tenantId)
            .orElseThrow(() -> new ServiceUnavailableException("whatsapp client not ready"));
        if (!client.isLoggedIn()) {
            throw new ServiceUnavailableException("whatsapp not logged in");
        }
        if (!client.isConnected()) {
            throw new ServiceUnavailableException("whatsapp disconnected");
        }
        return client;
    }

    /**
     * Prefix the content with the agent's name when the tenant signs messages.
     */
    private String applySignature(String tenantId, ChatwootWebhookPayload payload) {
        String content = payload.getContent();
        if (content == null || content.isEmpty()) {
            return content;
        }
        String agentName = payload.agentName();
        if (agentName == null || agentName.isBlank()) {
            return content;
        }
        Optional<BridgeConfig> config = bridgeConfigRepository.findByTenantId(tenantId);
        if (config.isEmpty() || !Boolean.TRUE.equals(config.get().getSignMessages())) {
            return content;
        }
        return sign(content, agentName, config.get().getSignDelimiter());
    }

    static String sign(String content, String agentName, String delimiter) {
        String separator = delimiter == null || delimiter.isEmpty()
            ? DEFAULT_SIGN_DELIMITER
            : delimiter.replace("\\n", "\n");
        return "*" + agentName + "*" + separator + content;
    }

    private void sendAttachment(String tenantId, WhatsAppClient client, String recipientJid,
                                Attachment attachment, String content) {
        String caption = content != null && !content.isEmpty() ? content : attachment.getDataUrl();
        MessageKind kind = kindOf(attachment.getFileType());
        try {
            DownloadedAttachment downloaded = attachmentDownloader.download(attachment.getDataUrl());
            String mimeType = downloaded.contentType() != null ? downloaded.contentType() : defaultMimeType(kind);
            // WhatsApp does not caption voice notes
            String effectiveCaption = kind == MessageKind.AUDIO ? null : caption;
            OutgoingMessage message = OutgoingMessage.media(kind, downloaded.data(), mimeType,
                downloaded.fileName(), effectiveCaption);

            String sentId = client.sendMessage(recipientJid, message);
            dedupGuard.register(sentId);
            log.info("Sent {} to {} for tenant {} (id={})", kind, recipientJid, tenantId, sentId);
        } catch (RuntimeException e) {
            log.error("Failed to send {} to {} for tenant {}: {}", kind, recipientJid, tenantId, e.getMessage(), e);
            bridgeMetrics.recordOutbound(OutboundOutcome.FAILED);
            throw new BridgeException("failed to send media", e);
        }
    }

    private void sendText(String tenantId, WhatsAppClient client, String recipientJid, String content) {
        try {
            String sentId = client.sendMessage(recipientJid, OutgoingMessage.text(content));
            dedupGuard.register(sentId);
            log.info("Sent text to {} for tenant {} (id={})", recipientJid, tenantId, sentId);
        } catch (RuntimeException e) {
            log.error("Failed to send text to {} for tenant {}: {}", recipientJid, tenantId, e.getMessage(), e);
            bridgeMetrics.recordOutbound(OutboundOutcome.FAILED);
            throw new BridgeException("failed to send message", e);
        }
    }

    static MessageKind kindOf(String fileType) {
        if (fileType == null) {
            return MessageKind.DOCUMENT;
        }
        switch (fileType) {
            case "image":
                return MessageKind.IMAGE;
            case "video":
                return MessageKind.VIDEO;
            case "audio":
                return MessageKind.AUDIO;
            default:
                return MessageKind.DOCUMENT;
        }
    }

    private static String defaultMimeType(MessageKind kind) {
        switch (kind) {
            case IMAGE:
                return "image/jpeg";
            case VIDEO:
                return "video/mp4";
            case AUDIO:
                return "audio/ogg";
            default:
                return "application/octet-stream";
        }
    }
}
