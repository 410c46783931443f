package com.clapgrow.bridge.common.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA-256 signatures over the exact bytes put on the wire.
 */
public final class HmacSigner {

    public static final String SIGNATURE_HEADER = "x-hmac-signature";

    private static final String ALGORITHM = "HmacSHA256";

    private HmacSigner() {
    }

    /**
     * @return lower-case hex signature of {@code payload} under {@code secret}
     */
    public static String sign(byte[] payload, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new VaultException("Failed to compute HMAC signature", e);
        }
    }
}
