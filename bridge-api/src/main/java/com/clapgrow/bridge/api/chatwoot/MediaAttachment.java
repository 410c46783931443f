package com.clapgrow.bridge.api.chatwoot;

/**
 * File bytes to upload as a Chatwoot message attachment.
 */
public record MediaAttachment(String fileName, String mimeType, byte[] data) {
}
