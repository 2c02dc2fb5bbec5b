package com.example.demo.deckgen.service;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.assembly.DocumentAssembler;
import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.catalog.TemplateCatalog;
import com.example.demo.deckgen.catalog.WorkingCopy;
import com.example.demo.deckgen.exception.RenderCancelledException;
import com.example.demo.deckgen.image.ImageResolver;
import com.example.demo.deckgen.image.ResolvedImage;
import com.example.demo.deckgen.layout.LayoutResolver;
import com.example.demo.deckgen.layout.ResolvedLayout;
import com.example.demo.deckgen.model.DeckGenerationRequest;
import com.example.demo.deckgen.model.ImageDescriptor;
import com.example.demo.deckgen.model.ImageSlide;
import com.example.demo.deckgen.model.SlideDeckSpec;
import com.example.demo.deckgen.model.SlideSpec;
import com.example.demo.deckgen.parser.SlideDeckParser;
import com.example.demo.deckgen.util.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for deck rendering.
 *
 * Resolves a layout per slide, fetches the deck's images in parallel,
 * composes everything into a private working copy of the template and
 * reports which slides were degraded or fell back to the placeholder image.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeckRenderer {
    private final SlideDeckParser parser;
    private final TemplateCatalog catalog;
    private final LayoutResolver layoutResolver;
    private final ImageResolver imageResolver;
    private final DocumentAssembler assembler;

    @LogExecutionTime("Total Deck Rendering")
    public RenderedDeck render(DeckGenerationRequest request) {
        SlideDeckSpec deck = parser.parse(request.getDeck(), request.getLanguage());
        return render(deck, request.getFileName());
    }

    public RenderedDeck render(SlideDeckSpec deck, String fileNameHint) {
        log.info("Rendering deck '{}' with {} slides", deck.getTitle(), deck.getSlides().size());
        List<SlideSpec> slides = deck.getSlides();

        List<ResolvedLayout> layouts = new ArrayList<>(slides.size());
        List<DegradedSlide> degraded = new ArrayList<>();
        Map<Integer, ImageDescriptor> wanted = new LinkedHashMap<>();
        for (int i = 0; i < slides.size(); i++) {
            SlideSpec slide = slides.get(i);
            ResolvedLayout layout = layoutResolver.resolve(slide);
            layouts.add(layout);
            if (layout.isDegraded()) {
                degraded.add(new DegradedSlide(i, layout.getRequestedKind(), layout.getLayout().getLayoutName()));
            }
            if (slide instanceof ImageSlide) {
                wanted.put(i, ((ImageSlide) slide).getImage());
            }
        }

        Map<Integer, ResolvedImage> images = imageResolver.resolveAll(wanted);
        checkCancelled();

        List<SlidePlan> plans = new ArrayList<>(slides.size());
        List<Integer> fallbackImageSlides = new ArrayList<>();
        for (int i = 0; i < slides.size(); i++) {
            ResolvedImage image = images.get(i);
            if (image != null && image.isFallbackUsed()) {
                fallbackImageSlides.add(i);
            }
            plans.add(new SlidePlan(i, slides.get(i), layouts.get(i), image));
        }

        byte[] bytes;
        try (WorkingCopy workingCopy = catalog.checkout()) {
            bytes = assembler.assemble(workingCopy, deck, plans);
        }
        checkCancelled();

        String fileName = FileNames.sanitize(fileNameHint, deck.getTitle() != null ? deck.getTitle() : slides.get(0).getTitle());
        log.info("Rendered '{}': {} slides, {} degraded, {} image fallbacks",
                fileName, slides.size(), degraded.size(), fallbackImageSlides.size());
        return RenderedDeck.builder()
                .bytes(bytes)
                .fileName(fileName)
                .slideCount(slides.size())
                .language(deck.getLanguage())
                .structure(deck)
                .degradedSlides(List.copyOf(degraded))
                .fallbackImageSlides(List.copyOf(fallbackImageSlides))
                .build();
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RenderCancelledException("Render cancelled by caller", null);
        }
    }
}
