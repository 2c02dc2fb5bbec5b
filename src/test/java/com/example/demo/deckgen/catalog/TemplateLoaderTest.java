package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.TestFixtures;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.exception.ResourceLoadingException;
import com.example.demo.deckgen.exception.TemplateCatalogException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Template and resource loading")
public class TemplateLoaderTest {

    @Test
    @DisplayName("Should synthesize the builtin template")
    public void testBuiltinTemplate() {
        DeckgenProperties properties = TestFixtures.properties();
        byte[] bytes = TestFixtures.templateLoader(properties).loadTemplateBytes();

        TemplateCatalog catalog = new TemplateCatalogBuilder().build("builtin", bytes);
        assertEquals(8, catalog.availableKinds().size());
    }

    @Test
    @DisplayName("Should load a template from the file system")
    public void testFileTemplate(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("corporate.pptx");
        Files.write(file, new BuiltinTemplateFactory().createBytes());
        DeckgenProperties properties = TestFixtures.properties();
        properties.getTemplate().setLocation(file.toUri().toString());

        byte[] bytes = TestFixtures.templateLoader(properties).loadTemplateBytes();
        assertArrayEquals(Files.readAllBytes(file), bytes);
    }

    @Test
    @DisplayName("Should report a missing template")
    public void testMissingTemplate() {
        DeckgenProperties properties = TestFixtures.properties();
        properties.getTemplate().setLocation("classpath:templates/does-not-exist.pptx");

        TemplateCatalogException e = assertThrows(TemplateCatalogException.class,
                () -> TestFixtures.templateLoader(properties).loadTemplateBytes());
        assertEquals("TEMPLATE_NOT_FOUND", e.getCode());
    }

    @Test
    @DisplayName("Should read classpath resources and reject blank paths")
    public void testResourceBytes() {
        TemplateLoader loader = TestFixtures.templateLoader(TestFixtures.properties());

        assertTrue(loader.getResourceBytes("classpath:images/placeholder.png").length > 0);
        assertEquals("RESOURCE_NOT_FOUND",
                assertThrows(ResourceLoadingException.class, () -> loader.getResourceBytes("classpath:nope.png")).getCode());
        assertEquals("INVALID_PATH",
                assertThrows(ResourceLoadingException.class, () -> loader.getResourceBytes(" ")).getCode());
    }
}
