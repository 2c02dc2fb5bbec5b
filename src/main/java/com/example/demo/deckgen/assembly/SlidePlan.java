package com.example.demo.deckgen.assembly;

import com.example.demo.deckgen.image.ResolvedImage;
import com.example.demo.deckgen.layout.ResolvedLayout;
import com.example.demo.deckgen.model.SlideSpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Everything needed to compose one slide: its position, content, layout and,
 * for image slides, the resolved image.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class SlidePlan {
    private final int index;
    private final SlideSpec slide;
    private final ResolvedLayout layout;
    private final ResolvedImage image;
}
