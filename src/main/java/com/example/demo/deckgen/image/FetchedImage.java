package com.example.demo.deckgen.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Raw provider response: bytes plus the declared content type.
 */
@Getter
@RequiredArgsConstructor
public class FetchedImage {
    private final byte[] bytes;
    private final String contentType;
}
