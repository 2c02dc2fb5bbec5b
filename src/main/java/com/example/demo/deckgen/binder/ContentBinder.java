package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.model.SlideSpec;

/**
 * Writes one aspect of a slide's content onto its canvas. Every binder whose
 * {@link #supports(SlideSpec)} accepts the slide is applied.
 */
public interface ContentBinder {

    boolean supports(SlideSpec slide);

    void bind(SlideCanvas canvas, SlidePlan plan);
}
