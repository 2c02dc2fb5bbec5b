package com.example.demo.deckgen.binder;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of fitting a text into a character budget: the font scale to apply
 * and how many characters survive (ellipsis marker included when truncated).
 */
@Getter
@ToString
@RequiredArgsConstructor
public class AutoFitResult {
    private final double scale;
    private final int maxChars;
    private final boolean truncated;
}
