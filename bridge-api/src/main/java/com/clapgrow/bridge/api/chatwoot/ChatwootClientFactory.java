package com.clapgrow.bridge.api.chatwoot;

import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Builds a {@link ChatwootClient} bound to a tenant's Chatwoot account.
 * Clients share the underlying connection pool of the application WebClient.
 */
@Component
@RequiredArgsConstructor
public class ChatwootClientFactory {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${bridge.http.timeout:30s}")
    private Duration timeout = Duration.ofSeconds(30);

    public ChatwootClient forConfig(BridgeConfig config) {
        return create(config.getUrl(), config.getAccountId(), config.getApiToken());
    }

    public ChatwootClient create(String baseUrl, String accountId, String apiToken) {
        WebClient accountClient = webClient.mutate()
            .baseUrl(stripTrailingSlash(baseUrl))
            .defaultHeader(ChatwootClient.AUTH_HEADER, apiToken)
            .build();
        return new ChatwootClient(accountClient, objectMapper, accountId, timeout);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
