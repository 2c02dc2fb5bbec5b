package com.example.demo.deckgen.image;

import com.example.demo.deckgen.config.DeckgenProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Image provider backed by the Unsplash search API. Takes the first landscape
 * result for a query and downloads its regular-size rendition.
 *
 * Disabled (always empty) when no access key is configured. Hits are cached
 * per query; misses are not, so a later request may still find an image.
 */
@Slf4j
@Component
public class UnsplashImageProvider implements ImageProvider {
    private final DeckgenProperties properties;
    private final Map<Duration, RestClient> clients = new ConcurrentHashMap<>();

    public UnsplashImageProvider(DeckgenProperties properties) {
        this.properties = properties;
    }

    /**
     * Client whose connect and read timeouts equal the given bound. Clients
     * are kept per distinct timeout.
     */
    RestClient clientFor(Duration timeout) {
        Duration bound = timeout == null ? properties.getImages().getTimeout() : timeout;
        return clients.computeIfAbsent(bound, UnsplashImageProvider::createClient);
    }

    private static RestClient createClient(Duration timeout) {
        int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(millis);
        requestFactory.setReadTimeout(millis);
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    @Cacheable(value = "imageSearch", key = "#query", unless = "#result == null")
    public Optional<FetchedImage> fetch(String query, Duration timeout) {
        DeckgenProperties.Unsplash unsplash = properties.getImages().getUnsplash();
        if (unsplash.getAccessKey() == null || unsplash.getAccessKey().isBlank()) {
            log.debug("Unsplash access key not configured, skipping search for '{}'", query);
            return Optional.empty();
        }
        RestClient restClient = clientFor(timeout);
        try {
            JsonNode search = restClient.get()
                    .uri(unsplash.getBaseUrl() + "/search/photos?query={query}&per_page=1&orientation=landscape", query)
                    .header(HttpHeaders.AUTHORIZATION, "Client-ID " + unsplash.getAccessKey())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode url = search == null ? null : search.path("results").path(0).path("urls").path("regular");
            if (url == null || !url.isTextual()) {
                log.warn("No Unsplash image for: {}", query);
                return Optional.empty();
            }
            ResponseEntity<byte[]> image = restClient.get()
                    .uri(URI.create(url.asText()))
                    .retrieve()
                    .toEntity(byte[].class);
            MediaType contentType = image.getHeaders().getContentType();
            if (image.getBody() == null) {
                return Optional.empty();
            }
            log.info("Unsplash image found for '{}'", query);
            return Optional.of(new FetchedImage(image.getBody(), contentType == null ? null : contentType.toString()));
        } catch (Exception e) {
            log.warn("Unsplash error for '{}': {}", query, e.getMessage());
            return Optional.empty();
        }
    }
}
