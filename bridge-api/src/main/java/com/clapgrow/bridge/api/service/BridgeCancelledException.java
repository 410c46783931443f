package com.clapgrow.bridge.api.service;

/**
 * The handling thread was interrupted; processing stopped before the next network call.
 */
public class BridgeCancelledException extends BridgeException {

    public BridgeCancelledException(String message) {
        super(message);
    }
}
