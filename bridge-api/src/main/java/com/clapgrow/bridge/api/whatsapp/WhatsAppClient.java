package com.clapgrow.bridge.api.whatsapp;

/**
 * One tenant's WhatsApp session, supplied by the protocol layer.
 * Implementations must be safe to call from several threads.
 */
public interface WhatsAppClient {

    boolean isLoggedIn();

    boolean isConnected();

    /**
     * Send a message and wait for the server acknowledgement.
     *
     * @param recipientJid user or group JID
     * @return id of the sent message, as it will appear on the event stream
     * @throws WhatsAppClientException when the send fails
     */
    String sendMessage(String recipientJid, OutgoingMessage message);

    /**
     * Download and decrypt a media blob.
     *
     * @throws WhatsAppClientException when the download fails
     */
    byte[] download(MediaReference media);
}
