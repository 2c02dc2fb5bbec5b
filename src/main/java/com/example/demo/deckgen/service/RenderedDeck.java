package com.example.demo.deckgen.service;

import com.example.demo.deckgen.model.SlideDeckSpec;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A finished presentation package and what happened while producing it.
 */
@Getter
@Builder
@ToString(exclude = "bytes")
public class RenderedDeck {
    private final byte[] bytes;
    private final String fileName;
    private final int slideCount;
    private final String language;
    private final SlideDeckSpec structure;
    private final List<DegradedSlide> degradedSlides;
    private final List<Integer> fallbackImageSlides;
}
