package com.clapgrow.bridge.api.delivery;

import com.clapgrow.bridge.api.config.DeliveryProperties;
import com.clapgrow.bridge.api.service.BridgeMetrics;
import com.clapgrow.bridge.api.service.BridgeMetrics.DeliveryOutcome;
import com.clapgrow.bridge.common.crypto.CredentialVault;
import com.clapgrow.bridge.common.crypto.HmacSigner;
import com.clapgrow.bridge.common.crypto.VaultException;
import com.clapgrow.bridge.common.retry.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Delivers WhatsApp events to tenant webhooks.
 *
 * <p>Each call makes up to {@link RetryPolicy#attempts()} attempts with exponential backoff
 * between them. A 2xx response is success; a non-2xx status, a redirect or a transport error
 * is a failed attempt. With retries disabled the first non-2xx ends the call. When every
 * attempt failed the delivery is dead-lettered and the caller is not told, except by
 * {@link #deliverFile}'s return value.
 *
 * <p>When the tenant has a signing key the {@value HmacSigner#SIGNATURE_HEADER} header
 * carries the HMAC-SHA256 of the exact body bytes sent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookDeliveryService {

    static final String JSON_DATA_KEY = "jsonData";
    static final String INSTANCE_NAME_KEY = "instanceName";
    static final String USER_ID_KEY = "userID";
    static final String FILE_KEY = "file";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CredentialVault credentialVault;
    private final DeliveryProperties deliveryProperties;
    private final DeadLetterPublisher deadLetterPublisher;
    private final BackoffSleeper backoffSleeper;
    private final BridgeMetrics bridgeMetrics;
    private final Clock clock;

    @Value("${bridge.http.timeout:30s}")
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Deliver an event body. Returns once the delivery succeeded or was dead-lettered.
     *
     * @param payload          event fields; a {@code jsonData} entry holding a JSON object becomes the
     *                         body in JSON mode, with {@code instanceName} merged into it
     * @param encryptedHmacKey the tenant's sealed signing key, or null for unsigned deliveries
     */
    public void deliver(String url, Map<String, Object> payload, String tenantId, byte[] encryptedHmacKey) {
        DeliveryMode mode = deliveryProperties.getMode();
        RetryPolicy policy = deliveryProperties.retryPolicy();

        Map<String, Object> body = buildBody(mode, payload, tenantId);
        byte[] bytes;
        MediaType contentType;
        try {
            if (mode == DeliveryMode.FORM) {
                bytes = formEncode(body).getBytes(StandardCharsets.UTF_8);
                contentType = MediaType.APPLICATION_FORM_URLENCODED;
            } else {
                bytes = objectMapper.writeValueAsBytes(body);
                contentType = MediaType.APPLICATION_JSON;
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to encode webhook payload for tenant {}", tenantId, e);
            deadLetter(url, body, tenantId, encryptedHmacKey, null, "failed to encode payload: " + e.getOriginalMessage());
            return;
        }

        Optional<String> signature;
        try {
            signature = signature(bytes, encryptedHmacKey);
        } catch (VaultException e) {
            log.error("Failed to open HMAC key of tenant {} - not delivering to {}", tenantId, url, e);
            deadLetter(url, body, tenantId, encryptedHmacKey, null, "failed to decrypt hmac key: " + e.getMessage());
            return;
        }

        final MediaType requestType = contentType;
        Optional<String> failure = executeWithRetry(url, tenantId, policy, () -> webClient.post()
            .uri(URI.create(url))
            .contentType(requestType)
            .headers(headers -> signature.ifPresent(value -> headers.set(HmacSigner.SIGNATURE_HEADER, value)))
            .bodyValue(bytes)
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> new Attempt(response.statusCode().value(), text)))
            .block(timeout));

        failure.ifPresent(error -> deadLetter(url, body, tenantId, encryptedHmacKey, null, error));
    }

    /**
     * Deliver an event together with a file as multipart/form-data. The signature covers the
     * JSON of the field map (keys sorted, {@code file} set to the path), not the file content.
     *
     * @return false when the delivery was dead-lettered
     */
    public boolean deliverFile(String url, Map<String, Object> payload, String tenantId,
                               String filePath, byte[] encryptedHmacKey) {
        RetryPolicy policy = deliveryProperties.retryPolicy();

        Map<String, Object> fields = new TreeMap<>(payload);
        fields.put(USER_ID_KEY, tenantId);
        fields.put(FILE_KEY, filePath);

        if (filePath == null || !Files.isReadable(Path.of(filePath))) {
            log.error("Webhook file {} for tenant {} is not readable", filePath, tenantId);
            deadLetter(url, fields, tenantId, encryptedHmacKey, filePath, "file not readable: " + filePath);
            return false;
        }

        Optional<String> signature;
        try {
            signature = signature(objectMapper.writeValueAsBytes(fields), encryptedHmacKey);
        } catch (JsonProcessingException | VaultException e) {
            log.error("Failed to sign file delivery to {} for tenant {}", url, tenantId, e);
            deadLetter(url, fields, tenantId, encryptedHmacKey, filePath, "failed to sign payload: " + e.getMessage());
            return false;
        }

        Optional<String> failure = executeWithRetry(url, tenantId, policy, () -> {
            MultipartBodyBuilder builder = new MultipartBodyBuilder();
            fields.forEach((key, value) -> {
                if (!FILE_KEY.equals(key)) {
                    builder.part(key, stringValue(value));
                }
            });
            builder.part(FILE_KEY, new FileSystemResource(filePath));
            return webClient.post()
                .uri(URI.create(url))
                .headers(headers -> signature.ifPresent(value -> headers.set(HmacSigner.SIGNATURE_HEADER, value)))
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(text -> new Attempt(response.statusCode().value(), text)))
                .block(timeout);
        });

        if (failure.isPresent()) {
            deadLetter(url, fields, tenantId, encryptedHmacKey, filePath, failure.get());
            return false;
        }
        return true;
    }

    /**
     * @return the last error when every attempt failed, empty on success
     */
    private Optional<String> executeWithRetry(String url, String tenantId, RetryPolicy policy, Supplier<Attempt> send) {
        int attempts = policy.attempts();
        String lastError = "no attempt made";

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Duration delay = policy.delayBefore(attempt);
            if (!delay.isZero()) {
                log.warn("Retrying webhook delivery to {} for tenant {} in {}ms (attempt {}/{}). Last error: {}",
                    url, tenantId, delay.toMillis(), attempt, attempts, lastError);
                bridgeMetrics.recordDelivery(DeliveryOutcome.RETRIED);
                try {
                    backoffSleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("Interrupted while retrying webhook delivery to {} for tenant {}", url, tenantId);
                    return Optional.of("delivery interrupted: " + lastError);
                }
            }

            Attempt result;
            try {
                result = send.get();
            } catch (RuntimeException e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Webhook delivery to {} for tenant {} failed (attempt {}/{}): {}",
                    url, tenantId, attempt, attempts, lastError);
                continue;
            }
            if (result == null) {
                lastError = "no response";
                continue;
            }

            if (result.status() >= 200 && result.status() < 300) {
                log.info("Webhook delivered to {} for tenant {} (status={}, attempt {}/{})",
                    url, tenantId, result.status(), attempt, attempts);
                bridgeMetrics.recordDelivery(DeliveryOutcome.DELIVERED);
                return Optional.empty();
            }

            lastError = String.format("unexpected status code: %d. Body: %s", result.status(), result.body());
            log.warn("Webhook delivery to {} for tenant {} rejected (attempt {}/{}): {}",
                url, tenantId, attempt, attempts, lastError);
            if (!policy.retryEnabled()) {
                break;
            }
        }

        log.error("Webhook delivery to {} for tenant {} failed after {} attempt(s): {}", url, tenantId, attempts, lastError);
        bridgeMetrics.recordDelivery(DeliveryOutcome.FAILED);
        return Optional.of(lastError);
    }

    /**
     * JSON mode unwraps {@code jsonData} when it holds an object; both modes inject {@code userID}.
     */
    Map<String, Object> buildBody(DeliveryMode mode, Map<String, Object> payload, String tenantId) {
        Map<String, Object> body = null;
        if (mode == DeliveryMode.JSON) {
            body = unwrapJsonData(payload.get(JSON_DATA_KEY));
            if (body != null && payload.get(INSTANCE_NAME_KEY) != null) {
                body.put(INSTANCE_NAME_KEY, payload.get(INSTANCE_NAME_KEY));
            }
        }
        if (body == null) {
            body = new LinkedHashMap<>(payload);
        }
        body.put(USER_ID_KEY, tenantId);
        return body;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> unwrapJsonData(Object jsonData) {
        if (jsonData instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) jsonData);
        }
        if (jsonData instanceof String && !((String) jsonData).isBlank()) {
            try {
                return objectMapper.readValue((String) jsonData, new TypeReference<LinkedHashMap<String, Object>>() {
                });
            } catch (JsonProcessingException e) {
                log.debug("jsonData is not a JSON object - sending the payload map as is");
            }
        }
        return null;
    }

    private Optional<String> signature(byte[] body, byte[] encryptedHmacKey) {
        if (encryptedHmacKey == null || encryptedHmacKey.length == 0) {
            return Optional.empty();
        }
        String key = credentialVault.decrypt(encryptedHmacKey);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(HmacSigner.sign(body, key));
    }

    static String formEncode(Map<String, Object> body) {
        return new TreeMap<>(body).entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(stringValue(entry.getValue()), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private static String stringValue(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private void deadLetter(String url, Map<String, Object> body, String tenantId, byte[] encryptedHmacKey,
                            String filePath, String error) {
        DeadLetterRecord record = new DeadLetterRecord(
            url,
            body,
            tenantId,
            encryptedHmacKey != null ? HexFormat.of().formatHex(encryptedHmacKey) : null,
            filePath,
            clock.instant(),
            error);
        deadLetterPublisher.publish(record);
    }

    private record Attempt(int status, String body) {
    }
}
