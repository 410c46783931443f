package com.clapgrow.bridge.api.whatsapp;

/**
 * Content the bridge asks the protocol client to send. Text messages only set
 * {@code text}; media messages set the bytes, MIME type and optional caption.
 */
public record OutgoingMessage(
    MessageKind kind,
    String text,
    byte[] data,
    String mimeType,
    String fileName,
    String caption
) {

    public static OutgoingMessage text(String text) {
        return new OutgoingMessage(MessageKind.TEXT, text, null, null, null, null);
    }

    public static OutgoingMessage media(MessageKind kind, byte[] data, String mimeType, String fileName, String caption) {
        if (!kind.isMedia()) {
            throw new IllegalArgumentException("Not a media kind: " + kind);
        }
        return new OutgoingMessage(kind, null, data, mimeType, fileName, caption);
    }
}
