package com.example.demo.deckgen.controller;

import com.example.demo.deckgen.catalog.TemplateCatalog;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.exception.RenderCancelledException;
import com.example.demo.deckgen.exception.SchemaValidationException;
import com.example.demo.deckgen.model.DeckGenerationRequest;
import com.example.demo.deckgen.model.SlideKind;
import com.example.demo.deckgen.service.DeckRenderer;
import com.example.demo.deckgen.service.RenderedDeck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for deck rendering
 */
@Slf4j
@RestController
@RequestMapping("/api/decks")
@RequiredArgsConstructor
public class DeckController {
    public static final MediaType PPTX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.presentationml.presentation");

    private final DeckRenderer deckRenderer;
    private final TemplateCatalog templateCatalog;

    /**
     * Render a deck and return it base64-encoded together with render metadata.
     *
     * POST /api/decks/render
     * {
     *   "fileName": "quarterly-review",
     *   "language": "en",
     *   "deck": {
     *     "title": "Quarterly Review",
     *     "slides": [
     *       { "kind": "title", "title": "Quarterly Review", "subtitle": "Q3" },
     *       { "kind": "content_only", "title": "Highlights", "bulletPoints": ["Revenue up", "Churn down"] }
     *     ]
     *   }
     * }
     */
    @PostMapping("/render")
    public ResponseEntity<?> render(@RequestBody DeckGenerationRequest request) {
        log.info("Received deck render request, fileName: {}", request.getFileName());
        try {
            RenderedDeck deck = deckRenderer.render(request);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("filename", deck.getFileName());
            body.put("fileBase64", Base64.getEncoder().encodeToString(deck.getBytes()));
            body.put("slideCount", deck.getSlideCount());
            body.put("language", deck.getLanguage());
            body.put("structure", deck.getStructure());
            body.put("degradedSlides", deck.getDegradedSlides());
            body.put("fallbackImageSlides", deck.getFallbackImageSlides());
            return ResponseEntity.ok(body);
        } catch (DeckGenerationException e) {
            return errorResponse(e);
        }
    }

    /**
     * Render a deck and download it as a .pptx file.
     */
    @PostMapping("/render/pptx")
    public ResponseEntity<?> renderPptx(@RequestBody DeckGenerationRequest request) {
        log.info("Received deck download request, fileName: {}", request.getFileName());
        try {
            RenderedDeck deck = deckRenderer.render(request);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(PPTX);
            headers.setContentDispositionFormData("attachment", deck.getFileName());
            headers.setContentLength(deck.getBytes().length);
            headers.add("X-Degraded-Slides", String.valueOf(deck.getDegradedSlides().size()));
            return new ResponseEntity<>(deck.getBytes(), headers, HttpStatus.OK);
        } catch (DeckGenerationException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("template", templateCatalog.getSource());
        List<String> layouts = templateCatalog.availableKinds().stream()
                .map(SlideKind::getLayoutName)
                .collect(Collectors.toList());
        body.put("layouts", layouts);
        return body;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(DeckGenerationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());

        if (e instanceof SchemaValidationException) {
            SchemaValidationException sve = (SchemaValidationException) e;
            body.put("description", sve.getReason());
            body.put("slideIndex", sve.getSlideIndex());
            log.warn("Rejected deck: {}", e.getMessage());
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        } else if (e instanceof RenderCancelledException) {
            log.warn("Render cancelled: {}", e.getMessage());
            return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
        }

        log.error("Deck rendering failed: {}", e.getMessage(), e);
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
