package com.example.demo.deckgen.parser;

import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.exception.SchemaValidationException;
import com.example.demo.deckgen.model.BulletPoint;
import com.example.demo.deckgen.model.ChartSeries;
import com.example.demo.deckgen.model.ChartSlide;
import com.example.demo.deckgen.model.ChartType;
import com.example.demo.deckgen.model.ContentSlide;
import com.example.demo.deckgen.model.ImageDescriptor;
import com.example.demo.deckgen.model.ImageSlide;
import com.example.demo.deckgen.model.SlideDeckSpec;
import com.example.demo.deckgen.model.SlideKind;
import com.example.demo.deckgen.model.SlideSpec;
import com.example.demo.deckgen.model.SlideText;
import com.example.demo.deckgen.model.TableSlide;
import com.example.demo.deckgen.model.TableStyle;
import com.example.demo.deckgen.model.TextFormatting;
import com.example.demo.deckgen.model.TextRun;
import com.example.demo.deckgen.model.TitleSlide;
import com.example.demo.deckgen.model.TwoColumnsSlide;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ingestion boundary: turns the upstream JSON deck description into a
 * validated {@link SlideDeckSpec}. Anything malformed is rejected here with a
 * {@link SchemaValidationException} that names the offending slide.
 *
 * Accepts both camelCase and snake_case keys ("bulletPoints" / "bullet_points").
 * When a slide has no "kind" it is inferred from its content: chart, then
 * table, then image (by position), then the "layout" hint, else content only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlideDeckParser {
    private final DeckgenProperties properties;

    public SlideDeckSpec parse(JsonNode root) {
        return parse(root, null);
    }

    /**
     * @param root deck document
     * @param languageOverride language tag from the request, wins over the document's
     */
    public SlideDeckSpec parse(JsonNode root, String languageOverride) {
        if (root == null || !root.isObject()) {
            throw new SchemaValidationException("Deck must be a JSON object");
        }
        JsonNode slidesNode = root.get("slides");
        if (slidesNode == null || !slidesNode.isArray()) {
            throw new SchemaValidationException("Deck requires a 'slides' array");
        }

        List<SlideSpec> slides = new ArrayList<>(slidesNode.size());
        for (int i = 0; i < slidesNode.size(); i++) {
            try {
                slides.add(parseSlide(slidesNode.get(i)));
            } catch (SchemaValidationException e) {
                throw e.atSlide(i);
            }
        }

        JsonNode countNode = field(root, "slideCount", "slide_count");
        Integer slideCount = null;
        if (countNode != null && !countNode.isNull()) {
            if (!countNode.canConvertToInt()) {
                throw new SchemaValidationException("slideCount must be an integer");
            }
            slideCount = countNode.asInt();
        }

        String language = languageOverride != null && !languageOverride.isBlank()
                ? languageOverride
                : text(root, "language");

        SlideDeckSpec deck = SlideDeckSpec.builder()
                .title(text(root, "title"))
                .subtitle(text(root, "subtitle"))
                .author(text(root, "author"))
                .subject(text(root, "subject"))
                .language(language)
                .slideCount(slideCount)
                .slides(slides)
                .build();
        log.debug("Parsed deck '{}' with {} slides (language: {})", deck.getTitle(), deck.getSlideCount(), deck.getLanguage());
        return deck;
    }

    private SlideSpec parseSlide(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("Slide must be a JSON object");
        }
        SlideKind kind = resolveKind(node);
        String title = text(node, "title");

        switch (kind) {
            case TITLE:
                return new TitleSlide(title, text(node, "subtitle"));
            case CONTENT_ONLY:
                return new ContentSlide(title, parseBody(node));
            case IMAGE_RIGHT:
            case IMAGE_LEFT:
            case IMAGE_FULL:
                return new ImageSlide(kind, title, parseImage(node.get("image")), parseBody(node));
            case TABLE:
                return parseTable(title, node.get("table"));
            case CHART:
                return parseChart(title, node.get("chart"));
            case TWO_COLUMNS:
                return new TwoColumnsSlide(title,
                        parseBullets(field(node, "left", "leftColumn", "left_column")),
                        parseBullets(field(node, "right", "rightColumn", "right_column")));
            default:
                throw new SchemaValidationException("Unsupported slide kind " + kind);
        }
    }

    SlideKind resolveKind(JsonNode node) {
        String declared = text(node, "kind");
        if (declared != null) {
            return SlideKind.fromJsonName(declared)
                    .orElseThrow(() -> new SchemaValidationException("Unknown slide kind '" + declared + "'"));
        }
        if (present(node, "chart")) {
            return SlideKind.CHART;
        }
        if (present(node, "table")) {
            return SlideKind.TABLE;
        }
        if (present(node, "image")) {
            String position = text(node.get("image"), "position");
            String normalized = position == null ? "right" : position.trim().toLowerCase(Locale.ROOT);
            return SlideKind.fromJsonName("image_" + normalized)
                    .orElseThrow(() -> new SchemaValidationException("Unknown image position '" + position + "'"));
        }
        String layoutHint = text(node, "layout");
        if (layoutHint != null) {
            SlideKind hinted = SlideKind.fromJsonName(layoutHint).orElse(null);
            if (hinted != null && hinted != SlideKind.CHART && hinted != SlideKind.TABLE && !hinted.isImageKind()) {
                return hinted;
            }
            log.debug("Ignoring layout hint '{}' without matching content", layoutHint);
        }
        return SlideKind.CONTENT_ONLY;
    }

    private SlideText parseBody(JsonNode node) {
        List<TextRun> runs = parseRuns(node.get("content"));
        List<BulletPoint> bullets = parseBullets(field(node, "bulletPoints", "bullet_points", "bullets"));
        return new SlideText(runs, bullets);
    }

    private List<TextRun> parseRuns(JsonNode content) {
        List<TextRun> runs = new ArrayList<>();
        if (content == null || content.isNull()) {
            return runs;
        }
        if (content.isObject() && content.has("runs")) {
            content = content.get("runs");
        }
        if (content.isTextual() || content.isNumber()) {
            if (!content.asText().isEmpty()) {
                runs.add(TextRun.plain(content.asText()));
            }
            return runs;
        }
        if (!content.isArray()) {
            throw new SchemaValidationException("'content' must be a string or a list of runs");
        }
        for (JsonNode runNode : content) {
            if (runNode.isTextual()) {
                runs.add(TextRun.plain(runNode.asText()));
            } else if (runNode.isObject()) {
                runs.add(new TextRun(text(runNode, "text"), parseFormatting(runNode.get("formatting")), text(runNode, "hyperlink")));
            } else {
                throw new SchemaValidationException("Text run must be a string or an object");
            }
        }
        return runs;
    }

    private List<BulletPoint> parseBullets(JsonNode node) {
        List<BulletPoint> bullets = new ArrayList<>();
        if (node == null || node.isNull()) {
            return bullets;
        }
        if (!node.isArray()) {
            throw new SchemaValidationException("Bullet points must be a list");
        }
        for (JsonNode item : node) {
            if (item.isTextual() || item.isNumber()) {
                bullets.add(BulletPoint.of(item.asText()));
            } else if (item.isObject()) {
                JsonNode level = item.get("level");
                if (level != null && !level.isNull() && !level.canConvertToInt()) {
                    throw new SchemaValidationException("Bullet level must be an integer");
                }
                bullets.add(new BulletPoint(text(item, "text"), level == null ? 0 : level.asInt(),
                        parseFormatting(item.get("formatting"))));
            } else {
                throw new SchemaValidationException("Bullet point must be a string or an object");
            }
        }
        return bullets;
    }

    private TextFormatting parseFormatting(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new SchemaValidationException("'formatting' must be an object");
        }
        JsonNode size = node.get("size");
        if (size != null && !size.isNull() && !size.isNumber()) {
            throw new SchemaValidationException("Formatting size must be a number");
        }
        return TextFormatting.builder()
                .bold(node.path("bold").asBoolean(false))
                .italic(node.path("italic").asBoolean(false))
                .color(text(node, "color"))
                .size(size == null || size.isNull() ? null : size.asDouble())
                .build();
    }

    private ImageDescriptor parseImage(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("Image slide requires an 'image' object");
        }
        // "path" is the legacy key for the search keywords
        String query = text(node, "query");
        if (query == null) {
            query = text(node, "path");
        }
        String fallback = text(node, "fallback");
        return new ImageDescriptor(query, fallback != null ? fallback : properties.getImages().getFallback());
    }

    private TableSlide parseTable(String title, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("Table slide requires a 'table' object");
        }
        JsonNode headerNode = field(node, "header", "headers");
        List<String> header = cells(headerNode, "Table header");
        JsonNode rowsNode = node.get("rows");
        if (rowsNode == null || !rowsNode.isArray()) {
            throw new SchemaValidationException("Table requires a 'rows' array");
        }
        List<List<String>> rows = new ArrayList<>(rowsNode.size());
        for (JsonNode rowNode : rowsNode) {
            rows.add(cells(rowNode, "Table row"));
        }
        String styleName = text(node, "style");
        TableStyle style = TableStyle.fromName(styleName)
                .orElseThrow(() -> new SchemaValidationException("Unknown table style '" + styleName + "'"));
        return new TableSlide(title, header, rows, style);
    }

    private ChartSlide parseChart(String title, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("Chart slide requires a 'chart' object");
        }
        String typeName = text(node, "type");
        ChartType type = typeName == null
                ? properties.getChart().getDefaultType()
                : ChartType.fromName(typeName).orElseThrow(() -> new SchemaValidationException("Unsupported chart type '" + typeName + "'"));

        List<String> categories = cells(node.get("categories"), "Chart categories");
        JsonNode seriesNode = node.get("series");
        if (seriesNode == null || !seriesNode.isArray()) {
            throw new SchemaValidationException("Chart requires a 'series' array");
        }
        List<ChartSeries> series = new ArrayList<>(seriesNode.size());
        for (JsonNode s : seriesNode) {
            JsonNode dataNode = field(s, "values", "data");
            if (dataNode == null || !dataNode.isArray()) {
                throw new SchemaValidationException("Chart series '" + text(s, "name") + "' requires a 'data' array");
            }
            List<Double> values = new ArrayList<>(dataNode.size());
            for (JsonNode v : dataNode) {
                if (!v.isNumber()) {
                    throw new SchemaValidationException("Chart series '" + text(s, "name") + "' contains a non-numeric value");
                }
                values.add(v.asDouble());
            }
            series.add(new ChartSeries(text(s, "name"), values));
        }
        return new ChartSlide(title, type, categories, series);
    }

    private List<String> cells(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new SchemaValidationException(what + " must be a list");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode cell : node) {
            if (cell.isContainerNode()) {
                throw new SchemaValidationException(what + " cells must be strings or numbers");
            }
            values.add(cell.isNull() ? "" : cell.asText());
        }
        return values;
    }

    private static JsonNode field(JsonNode node, String... names) {
        if (node == null) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static boolean present(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    private static String text(JsonNode node, String name) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw new SchemaValidationException("'" + name + "' must be a string");
        }
        return value.asText();
    }
}
