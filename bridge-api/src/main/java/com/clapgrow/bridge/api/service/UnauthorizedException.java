package com.clapgrow.bridge.api.service;

/**
 * Missing or unknown tenant token. Mapped to HTTP 401.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
