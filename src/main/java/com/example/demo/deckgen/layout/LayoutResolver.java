package com.example.demo.deckgen.layout;

import com.example.demo.deckgen.catalog.LayoutHandle;
import com.example.demo.deckgen.catalog.TemplateCatalog;
import com.example.demo.deckgen.exception.TemplateCatalogException;
import com.example.demo.deckgen.model.SlideKind;
import com.example.demo.deckgen.model.SlideSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutResolver {
    private final TemplateCatalog catalog;

    public ResolvedLayout resolve(SlideSpec slide) {
        SlideKind requested = slide.getKind();
        Optional<LayoutHandle> exact = catalog.resolve(requested);
        if (exact.isPresent()) {
            return new ResolvedLayout(exact.get(), requested, false);
        }
        LayoutHandle fallback = catalog.resolve(SlideKind.CONTENT_ONLY)
                .orElseThrow(() -> new TemplateCatalogException("MISSING_REQUIRED_LAYOUT",
                        "Template '" + catalog.getSource() + "' has no '" + SlideKind.CONTENT_ONLY.getLayoutName() + "' layout"));
        log.warn("Template has no '{}' layout; rendering slide '{}' with '{}'",
                requested.getLayoutName(), slide.getTitle(), fallback.getLayoutName());
        return new ResolvedLayout(fallback, requested, true);
    }
}
