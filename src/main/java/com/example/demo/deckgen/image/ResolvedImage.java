package com.example.demo.deckgen.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Image bytes ready to embed. Always present for an image slide: either the
 * provider's image or the fallback resource.
 */
@Getter
@ToString(exclude = "bytes")
@RequiredArgsConstructor
public class ResolvedImage {
    private final byte[] bytes;
    private final String contentType;
    private final boolean fallbackUsed;
    /** Query or resource the bytes came from. */
    private final String source;
}
