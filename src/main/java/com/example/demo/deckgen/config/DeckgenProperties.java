package com.example.demo.deckgen.config;

import com.example.demo.deckgen.model.ChartType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed configuration for the deck renderer.
 *
 * Example application.yml:
 *
 * deckgen:
 *   template:
 *     location: classpath:templates/corporate.pptx
 *   images:
 *     timeout: 5s
 *     pool-size: 4
 *     fallback: classpath:images/placeholder.png
 *     unsplash:
 *       access-key: ${UNSPLASH_ACCESS_KEY:}
 *   text:
 *     body-budget: 500
 *     scale-step: 0.1
 *     min-scale: 0.5
 *   chart:
 *     default-type: BAR
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "deckgen")
public class DeckgenProperties {

    private Template template = new Template();
    @Valid
    private Images images = new Images();
    @Valid
    private Text text = new Text();
    @Valid
    private Table table = new Table();
    private Chart chart = new Chart();

    @Data
    public static class Template {
        /**
         * Spring resource location of the .pptx template, or "builtin" to
         * synthesize one from the POI default master.
         */
        private String location = "builtin";
    }

    @Data
    public static class Images {
        /**
         * Upper bound for a single provider fetch.
         */
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Worker threads shared by all renders for provider calls.
         */
        @Positive(message = "Image fetch pool size must be positive")
        private int poolSize = 4;

        /**
         * Resource embedded when the provider yields nothing usable.
         */
        private String fallback = "classpath:images/placeholder.png";

        private Unsplash unsplash = new Unsplash();
    }

    @Data
    public static class Unsplash {
        /**
         * Client-ID key; the provider is disabled when blank.
         */
        private String accessKey = "";

        private String baseUrl = "https://api.unsplash.com";
    }

    @Data
    public static class Text {
        @Positive(message = "Title budget must be positive")
        private int titleBudget = 120;
        @Positive(message = "Body budget must be positive")
        private int bodyBudget = 500;
        @Positive(message = "Column budget must be positive")
        private int columnBudget = 300;

        /**
         * Font scale decrement applied per auto-fit step.
         */
        @Positive(message = "Auto-fit scale step must be positive")
        private double scaleStep = 0.1;

        /**
         * Lowest font scale before truncation kicks in.
         */
        @DecimalMin(value = "0.0", inclusive = false, message = "Minimum font scale must be above 0")
        @DecimalMax(value = "1.0", message = "Minimum font scale cannot exceed 1")
        private double minScale = 0.5;

        private String ellipsis = "…";

        /**
         * Used as the base size when the template does not resolve one.
         */
        private double defaultTitleFontSize = 40;
        private double defaultBodyFontSize = 20;
    }

    @Data
    public static class Table {
        /**
         * Row height in points when the grid grows freely.
         */
        @Positive(message = "Table row height must be positive")
        private double rowHeight = 28;
        private double minFontSize = 8;
        private double maxFontSize = 16;
        private String headerFill = "#D9D9D9";
        private String headerColoredFill = "#003366";
        private String headerColoredText = "#FFFFFF";
        private String borderColor = "#A6A6A6";
    }

    @Data
    public static class Chart {
        private ChartType defaultType = ChartType.BAR;
    }
}
