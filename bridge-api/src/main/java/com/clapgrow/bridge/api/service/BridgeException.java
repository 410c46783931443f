package com.clapgrow.bridge.api.service;

/**
 * Unexpected failure while moving a message across the bridge. Mapped to HTTP 500
 * on the webhook path; logged by the event router on the inbound path.
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
