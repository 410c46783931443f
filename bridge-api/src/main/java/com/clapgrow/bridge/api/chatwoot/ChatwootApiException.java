package com.clapgrow.bridge.api.chatwoot;

/**
 * Chatwoot answered with a non-2xx status, or the call could not be completed.
 * {@link #getStatusCode()} is 0 for transport failures.
 */
public class ChatwootApiException extends RuntimeException {

    private final int statusCode;

    public ChatwootApiException(int statusCode, String message) {
        super(String.format("HTTP %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public ChatwootApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
