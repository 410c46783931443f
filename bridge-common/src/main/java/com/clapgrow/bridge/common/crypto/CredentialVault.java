package com.clapgrow.bridge.common.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Seals per-tenant signing secrets at rest with AES-GCM.
 *
 * <p>Sealed values are laid out as {@code nonce || ciphertext || tag} with a
 * 12-byte random nonce. The key is process-wide and never changes after
 * construction, so a single instance is safe to share between threads.
 *
 * <p>The configured key may be given either as Base64 (16, 24 or 32 decoded
 * bytes) or as a raw string of exactly 16, 24 or 32 characters.
 */
@Slf4j
public class CredentialVault {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_SIZE = 256;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    private CredentialVault(SecretKey secretKey) {
        this.secretKey = secretKey;
    }

    /**
     * Build a vault from the configured key material.
     *
     * @param configuredKey Base64 or raw key; blank means "not configured"
     * @return a vault that rejects every operation when no key is configured
     */
    public static CredentialVault fromConfiguredKey(String configuredKey) {
        if (configuredKey == null || configuredKey.isBlank()) {
            log.warn("No encryption key configured - signing secrets cannot be opened");
            return new CredentialVault(null);
        }
        return new CredentialVault(new SecretKeySpec(resolveKeyBytes(configuredKey.trim()), ALGORITHM));
    }

    /**
     * Generate a new random 256-bit key, Base64 encoded.
     */
    public static String generateKey() {
        try {
            KeyGenerator keyGenerator = KeyGenerator.getInstance(ALGORITHM);
            keyGenerator.init(KEY_SIZE, new SecureRandom());
            return Base64.getEncoder().encodeToString(keyGenerator.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new VaultException("Failed to generate encryption key", e);
        }
    }

    public boolean isConfigured() {
        return secretKey != null;
    }

    public byte[] encrypt(String plainText) {
        requireKey();
        if (plainText == null) {
            throw new VaultException("Cannot encrypt a null value");
        }
        try {
            byte[] nonce = new byte[NONCE_LENGTH];
            secureRandom.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] cipherText = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            byte[] sealed = new byte[NONCE_LENGTH + cipherText.length];
            System.arraycopy(nonce, 0, sealed, 0, NONCE_LENGTH);
            System.arraycopy(cipherText, 0, sealed, NONCE_LENGTH, cipherText.length);
            return sealed;
        } catch (GeneralSecurityException e) {
            throw new VaultException("Encryption failed", e);
        }
    }

    public String decrypt(byte[] sealed) {
        requireKey();
        if (sealed == null || sealed.length <= NONCE_LENGTH) {
            throw new VaultException("Ciphertext too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, sealed, 0, NONCE_LENGTH));
            byte[] plain = cipher.doFinal(sealed, NONCE_LENGTH, sealed.length - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new VaultException("Decryption failed", e);
        }
    }

    private void requireKey() {
        if (secretKey == null) {
            throw new VaultException("Encryption key not configured");
        }
    }

    // Raw keys win so secrets sealed with a plain 32-character key keep opening
    private static byte[] resolveKeyBytes(String configuredKey) {
        byte[] raw = configuredKey.getBytes(StandardCharsets.UTF_8);
        if (isValidKeyLength(raw.length)) {
            return raw;
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(configuredKey);
            if (isValidKeyLength(decoded.length)) {
                return decoded;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Encryption key is neither a raw AES key nor Base64");
        }
        throw new VaultException("Encryption key must be 16, 24 or 32 bytes (raw or Base64), got " + raw.length + " characters");
    }

    private static boolean isValidKeyLength(int length) {
        return length == 16 || length == 24 || length == 32;
    }
}
