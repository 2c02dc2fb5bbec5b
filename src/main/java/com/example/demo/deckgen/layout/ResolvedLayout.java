package com.example.demo.deckgen.layout;

import com.example.demo.deckgen.catalog.LayoutHandle;
import com.example.demo.deckgen.model.SlideKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Layout chosen for one slide. Degraded when the template had no layout for
 * the requested kind and the content layout stands in.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ResolvedLayout {
    private final LayoutHandle layout;
    private final SlideKind requestedKind;
    private final boolean degraded;
}
