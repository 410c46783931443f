package com.clapgrow.bridge.api.whatsapp;

/**
 * Raised by a {@link WhatsAppClient} when a send or download fails.
 */
public class WhatsAppClientException extends RuntimeException {

    public WhatsAppClientException(String message) {
        super(message);
    }

    public WhatsAppClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
