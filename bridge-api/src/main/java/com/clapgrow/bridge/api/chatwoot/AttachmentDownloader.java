package com.clapgrow.bridge.api.chatwoot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches the bytes behind a Chatwoot attachment {@code data_url}.
 *
 * <p>The shared WebClient does not follow redirects, but Chatwoot serves attachments
 * through storage redirects, so this class follows up to {@value #MAX_REDIRECTS} hops itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttachmentDownloader {

    static final int MAX_REDIRECTS = 5;
    static final String DEFAULT_FILE_NAME = "attachment";

    private final WebClient webClient;

    @Value("${bridge.http.timeout:30s}")
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * @throws ChatwootApiException when the download fails or ends on a non-2xx status
     */
    public DownloadedAttachment download(String url) {
        if (url == null || url.isBlank()) {
            throw new ChatwootApiException("Attachment has no data_url", null);
        }

        URI current = URI.create(url);
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            Fetched fetched;
            try {
                fetched = fetch(current);
            } catch (RuntimeException e) {
                throw new ChatwootApiException("Attachment download failed: " + current + ": " + e.getMessage(), e);
            }
            if (fetched == null) {
                throw new ChatwootApiException("Attachment download returned no response: " + current, null);
            }

            if (fetched.status() >= 300 && fetched.status() < 400 && fetched.location() != null) {
                log.debug("Attachment download redirected: {} -> {}", current, fetched.location());
                current = current.resolve(fetched.location());
                continue;
            }
            if (fetched.status() < 200 || fetched.status() >= 300) {
                throw new ChatwootApiException(fetched.status(), "attachment download failed for " + current);
            }

            byte[] data = fetched.body() != null ? fetched.body() : new byte[0];
            log.debug("Downloaded attachment {} ({} bytes, {})", current, data.length, fetched.contentType());
            return new DownloadedAttachment(data, fetched.contentType(), fileNameOf(current));
        }
        throw new ChatwootApiException("Attachment download exceeded " + MAX_REDIRECTS + " redirects: " + url, null);
    }

    private Fetched fetch(URI uri) {
        return webClient.get()
            .uri(uri)
            .exchangeToMono(response -> {
                HttpHeaders headers = response.headers().asHttpHeaders();
                String location = headers.getFirst(HttpHeaders.LOCATION);
                MediaType contentType = headers.getContentType();
                int status = response.statusCode().value();
                return response.bodyToMono(byte[].class)
                    .map(body -> new Fetched(status, body, location, contentType))
                    .switchIfEmpty(Mono.fromSupplier(() -> new Fetched(status, null, location, contentType)));
            })
            .block(timeout);
    }

    /**
     * Last path segment of the URL, decoded; {@value #DEFAULT_FILE_NAME} when the path is empty.
     */
    static String fileNameOf(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            return DEFAULT_FILE_NAME;
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        String decoded = URLDecoder.decode(segment, StandardCharsets.UTF_8);
        return decoded.isBlank() ? DEFAULT_FILE_NAME : decoded;
    }

    public record DownloadedAttachment(byte[] data, String contentType, String fileName) {
    }

    private record Fetched(int status, byte[] body, String location, MediaType mediaType) {

        String contentType() {
            return mediaType != null ? mediaType.toString() : null;
        }
    }
}
