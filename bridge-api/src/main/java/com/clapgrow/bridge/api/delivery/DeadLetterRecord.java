package com.clapgrow.bridge.api.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A webhook delivery that failed every attempt. Published as JSON to the dead-letter topic.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeadLetterRecord {
    private String url;
    /** Body as it was sent on the last attempt. */
    private Map<String, Object> payload;
    @JsonProperty("userID")
    private String userId;
    /** Hex of the sealed HMAC key, never the plain key. */
    private String encryptedHmacKey;
    /** Only for file deliveries. */
    private String filePath;
    private Instant attemptTime;
    private String errorMessage;
}
