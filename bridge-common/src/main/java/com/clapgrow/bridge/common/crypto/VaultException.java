package com.clapgrow.bridge.common.crypto;

/**
 * Thrown when a secret cannot be sealed or opened by the {@link CredentialVault}.
 */
public class VaultException extends RuntimeException {

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
