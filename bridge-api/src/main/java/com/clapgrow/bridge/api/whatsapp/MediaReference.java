package com.clapgrow.bridge.api.whatsapp;

/**
 * Handle the protocol client needs to download an encrypted media blob.
 * The bridge never interprets these fields.
 */
public record MediaReference(
    String url,
    String directPath,
    String mediaKey,
    String fileSha256,
    long fileLength
) {
}
