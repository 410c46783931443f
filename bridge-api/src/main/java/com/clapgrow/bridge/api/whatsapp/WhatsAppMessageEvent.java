package com.clapgrow.bridge.api.whatsapp;

import java.time.Instant;

/**
 * A message seen on a tenant's WhatsApp event stream.
 *
 * @param chatJid   conversation address: the peer for direct chats, the group for group chats
 * @param senderJid participant who sent the message; equals {@code chatJid} for direct chats
 * @param fromMe    sent by the tenant's own account (from the phone or another linked device)
 * @param text      conversation or extended text body; null for media-only messages
 * @param caption   media caption, when the kind is media
 * @param media     download handle, when the kind is media
 */
public record WhatsAppMessageEvent(
    String messageId,
    String chatJid,
    String senderJid,
    boolean group,
    boolean fromMe,
    String pushName,
    MessageKind kind,
    String text,
    String caption,
    String mimeType,
    String fileName,
    MediaReference media,
    Instant timestamp
) {

    public static WhatsAppMessageEvent text(String messageId, String chatJid, String pushName, boolean fromMe, String text) {
        return new WhatsAppMessageEvent(messageId, chatJid, chatJid, false, fromMe, pushName,
            MessageKind.TEXT, text, null, null, null, null, Instant.now());
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * True when the message carries nothing worth forwarding: a control message,
     * or neither text nor a recognised media kind.
     */
    public boolean isNoise() {
        if (kind == null || kind.isControl()) {
            return true;
        }
        return !hasText() && !kind.isMedia();
    }
}
