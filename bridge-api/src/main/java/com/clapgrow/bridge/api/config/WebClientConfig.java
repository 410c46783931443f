package com.clapgrow.bridge.api.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient for the Chatwoot API, tenant webhooks and attachment downloads.
 * Redirects are not followed: a 3xx from a webhook target is a failed attempt.
 */
@Configuration
public class WebClientConfig {

    @Value("${bridge.http.timeout:30s}")
    private Duration timeout;

    @Value("${bridge.http.max-in-memory-size:10485760}")
    private int maxInMemorySize;

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
            .responseTimeout(timeout)
            .followRedirect(false);

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
            .build();
    }
}
