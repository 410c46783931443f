package com.clapgrow.bridge.api.config;

import com.clapgrow.bridge.common.crypto.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-wide credential vault for tenant HMAC keys.
 * The key is read once at startup and never reloaded.
 */
@Configuration
@Slf4j
public class EncryptionConfig {

    @Value("${bridge.encryption.key:}")
    private String encryptionKey;

    @Bean
    public CredentialVault credentialVault() {
        CredentialVault vault = CredentialVault.fromConfiguredKey(encryptionKey);
        if (vault.isConfigured()) {
            log.info("Credential vault initialised - webhook signing enabled for tenants with an HMAC key");
        } else {
            log.warn("Credential vault has no key - webhooks will be delivered unsigned");
        }
        return vault;
    }
}
