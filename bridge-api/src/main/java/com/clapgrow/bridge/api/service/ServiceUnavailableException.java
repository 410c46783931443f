package com.clapgrow.bridge.api.service;

/**
 * The tenant's WhatsApp client is missing, logged out or disconnected.
 * Mapped to HTTP 503; the caller should not treat it as a client error.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
