package com.clapgrow.bridge.api.whatsapp;

/**
 * Payload kind of a WhatsApp message as reported by the protocol client.
 */
public enum MessageKind {
    TEXT,
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    STICKER,
    PROTOCOL,
    REACTION,
    POLL_CREATION,
    POLL_UPDATE,
    KEEP_IN_CHAT,
    UNKNOWN;

    public boolean isMedia() {
        return this == IMAGE || this == VIDEO || this == AUDIO || this == DOCUMENT || this == STICKER;
    }

    /**
     * Control and interaction messages that never carry user-visible content.
     */
    public boolean isControl() {
        return this == PROTOCOL || this == REACTION || this == POLL_CREATION
            || this == POLL_UPDATE || this == KEEP_IN_CHAT;
    }
}
