package com.example.demo.deckgen.config;

import com.example.demo.deckgen.catalog.TemplateCatalog;
import com.example.demo.deckgen.catalog.TemplateCatalogBuilder;
import com.example.demo.deckgen.catalog.TemplateLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the shared template catalog at startup. A broken template stops the
 * application from starting.
 */
@Slf4j
@Configuration
public class TemplateCatalogConfiguration {

    @Bean
    public TemplateCatalog templateCatalog(TemplateLoader loader, TemplateCatalogBuilder builder, DeckgenProperties properties) {
        String location = properties.getTemplate().getLocation();
        log.info("Loading presentation template from '{}'", location);
        return builder.build(location, loader.loadTemplateBytes());
    }
}
