package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.exception.ResourceLoadingException;
import com.example.demo.deckgen.exception.TemplateCatalogException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the presentation template and other raw resources (fallback images)
 * from the classpath or file system.
 *
 * The template location {@code builtin} selects the generated default template
 * instead of a file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateLoader {
    public static final String BUILTIN = "builtin";

    private final ResourceLoader resourceLoader;
    private final DeckgenProperties properties;
    private final BuiltinTemplateFactory builtinTemplateFactory;

    /**
     * Bytes of the configured template document.
     */
    @LogExecutionTime("Loading Template")
    public byte[] loadTemplateBytes() {
        String location = properties.getTemplate().getLocation();
        if (location == null || location.isBlank() || BUILTIN.equalsIgnoreCase(location.trim())) {
            log.info("Using builtin presentation template");
            return builtinTemplateFactory.createBytes();
        }
        try {
            return readResource(location.trim());
        } catch (ResourceLoadingException e) {
            String code = "RESOURCE_NOT_FOUND".equals(e.getCode()) ? "TEMPLATE_NOT_FOUND" : "TEMPLATE_READ_ERROR";
            throw new TemplateCatalogException(code, "Template could not be loaded from '" + location + "'", e);
        }
    }

    /**
     * Fetch a raw resource with caching
     */
    @Cacheable(value = "rawResources", key = "#path")
    public byte[] getResourceBytes(String path) {
        if (path == null || path.isBlank()) {
            throw new ResourceLoadingException("INVALID_PATH", "Resource path cannot be null or empty");
        }
        log.info("Fetching raw resource (cache miss): {}", path);
        return readResource(path.trim());
    }

    private byte[] readResource(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ResourceLoadingException("RESOURCE_NOT_FOUND", "Resource not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            return is.readAllBytes();
        } catch (IOException e) {
            log.error("Failed to read resource bytes from stream: {}", location, e);
            throw new ResourceLoadingException("RESOURCE_READ_ERROR", "Failed to read resource: " + location, e);
        }
    }
}
