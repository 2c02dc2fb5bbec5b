package com.example.demo.deckgen.image;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of stock images for a topic query.
 *
 * Implementations return empty for every failure (no key, no match, HTTP
 * error, timeout) and never throw.
 */
public interface ImageProvider {

    Optional<FetchedImage> fetch(String query, Duration timeout);
}
