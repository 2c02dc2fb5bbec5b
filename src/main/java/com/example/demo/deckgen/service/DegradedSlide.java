package com.example.demo.deckgen.service;

import com.example.demo.deckgen.model.SlideKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A slide rendered on a substitute layout because the template lacked the
 * requested one.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class DegradedSlide {
    private final int index;
    private final SlideKind requestedKind;
    private final String layoutName;
}
