package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.ChatwootClient;
import com.clapgrow.bridge.api.chatwoot.ChatwootClientFactory;
import com.clapgrow.bridge.api.chatwoot.MediaAttachment;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.clapgrow.bridge.api.entity.MessageMapping;
import com.clapgrow.bridge.api.repository.BridgeConfigRepository;
import com.clapgrow.bridge.api.repository.MessageMappingRepository;
import com.clapgrow.bridge.api.service.BridgeMetrics.InboundOutcome;
import com.clapgrow.bridge.api.whatsapp.MessageKind;
import com.clapgrow.bridge.api.whatsapp.WhatsAppClient;
import com.clapgrow.bridge.api.whatsapp.WhatsAppMessageEvent;
import com.clapgrow.bridge.common.phone.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Forwards WhatsApp messages into the tenant's Chatwoot inbox.
 *
 * <p>Processing is at-most-once: the message id is claimed in the {@link DedupGuard}
 * before any remote call, so a failure further down is not retried unless the
 * protocol layer redelivers the event under a new id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BridgeService {

    public static final String MESSAGE_SOURCE_PREFIX = "WAID:";
    public static final String TYPE_INCOMING = "incoming";
    public static final String TYPE_OUTGOING = "outgoing";

    private final DedupGuard dedupGuard;
    private final BridgeConfigRepository bridgeConfigRepository;
    private final ChatwootClientFactory chatwootClientFactory;
    private final ConversationCache conversationCache;
    private final MessageMappingRepository messageMappingRepository;
    private final BridgeMetrics bridgeMetrics;

    /**
     * Handle one WhatsApp message for a tenant.
     *
     * @param whatsAppClient the tenant's session, used to download media
     * @throws BridgeCancelledException when the calling thread is interrupted between remote calls
     * @throws BridgeException when a Chatwoot or WhatsApp call fails
     */
    public void handleIncomingMessage(String tenantId, WhatsAppMessageEvent event, WhatsAppClient whatsAppClient) {
        if (!dedupGuard.markIfAbsent(event.messageId())) {
            log.debug("Duplicate message {} for tenant {} - skipping", event.messageId(), tenantId);
            bridgeMetrics.recordInbound(InboundOutcome.DUPLICATE);
            return;
        }

        if (event.isNoise()) {
            log.debug("Message {} ({}) carries no forwardable content - skipping", event.messageId(), event.kind());
            bridgeMetrics.recordInbound(InboundOutcome.FILTERED);
            return;
        }

        Optional<BridgeConfig> configOpt = bridgeConfigRepository.findByTenantId(tenantId);
        if (configOpt.isEmpty() || !configOpt.get().isActive()) {
            log.debug("Chatwoot bridge inactive for tenant {} - skipping message {}", tenantId, event.messageId());
            bridgeMetrics.recordInbound(InboundOutcome.INACTIVE);
            return;
        }
        BridgeConfig config = configOpt.get();

        String chatJid = event.chatJid();
        String senderJid = event.group() && event.senderJid() != null ? event.senderJid() : chatJid;
        String contactName = event.pushName() != null && !event.pushName().isBlank()
            ? event.pushName()
            : PhoneNumbers.localPart(senderJid);
        String messageType = event.fromMe() ? TYPE_OUTGOING : TYPE_INCOMING;

        try {
            ChatwootClient client = chatwootClientFactory.forConfig(config);

            long contactId = ensureContact(client, config, senderJid, contactName);

            checkCancelled(event);
            long conversationId = conversationCache.ensureConversation(tenantId, client, config, contactId, chatJid);

            checkCancelled(event);
            long chatwootMessageId = forwardContent(client, conversationId, messageType, event, whatsAppClient);

            saveMessageMapping(tenantId, event.messageId(), chatwootMessageId, conversationId);
            bridgeMetrics.recordInbound(InboundOutcome.FORWARDED);
            log.info("Forwarded message {} from {} to Chatwoot conversation {} (tenant={}, type={})",
                event.messageId(), chatJid, conversationId, tenantId, messageType);
        } catch (BridgeException e) {
            bridgeMetrics.recordInbound(InboundOutcome.FAILED);
            throw e;
        } catch (RuntimeException e) {
            bridgeMetrics.recordInbound(InboundOutcome.FAILED);
            throw new BridgeException(String.format("Failed to forward message %s from %s for tenant %s: %s",
                event.messageId(), chatJid, tenantId, e.getMessage()), e);
        }
    }

    private long ensureContact(ChatwootClient client, BridgeConfig config, String senderJid, String contactName) {
        String phone = PhoneNumbers.toE164(PhoneNumbers.localPart(senderJid));

        checkCancelled(senderJid);
        Optional<Long> existing = client.findContactByPhone(phone);

        if (existing.isEmpty() && Boolean.TRUE.equals(config.getMergeBrazilContacts())) {
            Optional<String> alternate = PhoneNumbers.brazilianAlternate(phone);
            if (alternate.isPresent()) {
                checkCancelled(senderJid);
                existing = client.findContactByPhone(alternate.get());
                existing.ifPresent(id -> log.debug("Matched contact {} through Brazilian alternate {}", id, alternate.get()));
            }
        }
        if (existing.isPresent()) {
            return existing.get();
        }

        if (!config.hasInbox()) {
            throw new BridgeException("inbox id not configured for tenant " + config.getTenantId());
        }

        checkCancelled(senderJid);
        String contactPhone = PhoneNumbers.isGroup(senderJid) ? null : phone;
        return client.createContact(config.getInboxId(), contactName, contactPhone, senderJid, null);
    }

    private long forwardContent(ChatwootClient client, long conversationId, String messageType,
                                WhatsAppMessageEvent event, WhatsAppClient whatsAppClient) {
        String sourceId = MESSAGE_SOURCE_PREFIX + event.messageId();

        if (event.kind().isMedia()) {
            if (event.media() == null) {
                throw new BridgeException("media message " + event.messageId() + " has no download reference");
            }
            if (whatsAppClient == null) {
                throw new BridgeException("whatsapp client not available to download media of " + event.messageId());
            }
            byte[] data = whatsAppClient.download(event.media());
            log.debug("Downloaded {} bytes of {} for message {}", data.length, event.kind(), event.messageId());

            checkCancelled(event);
            MediaAttachment attachment = new MediaAttachment(mediaFileName(event), event.mimeType(), data);
            String caption = event.kind() == MessageKind.AUDIO ? null : event.caption();
            return client.sendMediaMessage(conversationId, messageType, attachment, caption, sourceId);
        }

        return client.createMessage(conversationId, messageType, event.text(), false, sourceId);
    }

    private void saveMessageMapping(String tenantId, String messageId, long chatwootMessageId, long conversationId) {
        try {
            MessageMapping mapping = new MessageMapping();
            mapping.setTenantId(tenantId);
            mapping.setMessageId(messageId);
            mapping.setChatwootMessageId(chatwootMessageId);
            mapping.setChatwootConversationId(conversationId);
            messageMappingRepository.save(mapping);
        } catch (RuntimeException e) {
            log.warn("Failed to save message mapping for {} (tenant={}): {}", messageId, tenantId, e.getMessage());
        }
    }

    /**
     * File name Chatwoot shows for an attachment, derived from the message id and MIME type.
     */
    static String mediaFileName(WhatsAppMessageEvent event) {
        String id = event.messageId();
        String mimeType = event.mimeType() != null ? event.mimeType() : "";
        switch (event.kind()) {
            case IMAGE:
                return id + ("image/png".equals(mimeType) ? ".png" : ".jpg");
            case VIDEO:
                return id + ".mp4";
            case AUDIO:
                return id + ("audio/mpeg".equals(mimeType) ? ".mp3" : ".ogg");
            case STICKER:
                return id + ".webp";
            case DOCUMENT:
                return event.fileName() != null && !event.fileName().isBlank() ? event.fileName() : id + ".pdf";
            default:
                return id;
        }
    }

    private static void checkCancelled(Object context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new BridgeCancelledException("Bridge handling cancelled: " + describe(context));
        }
    }

    private static String describe(Object context) {
        if (context instanceof WhatsAppMessageEvent) {
            return "message " + ((WhatsAppMessageEvent) context).messageId();
        }
        return String.valueOf(context);
    }
}
