package com.clapgrow.bridge.api.service;

/**
 * Client error: malformed payload, missing destination, missing mandatory field.
 * Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
