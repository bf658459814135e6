package com.knowledgeinbox.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

class AppConfigTest {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    @Test
    void shouldProvideDefaultsWithoutAFile() {
        AppConfig config = new AppConfig();

        assertEquals(500, config.getChunking().getWindowSize());
        assertEquals(50, config.getChunking().getOverlap());
        assertEquals(50_000, config.getIngestion().getMaxNoteLength());
        assertEquals("local", config.getEmbedding().getProvider());
        assertEquals(0.7, config.getGeneration().getTemperature(), 1e-9);
        assertEquals(800, config.getGeneration().getMaxTokens());
        assertEquals(5, config.getQuery().getDefaultMaxResults());
        assertEquals(10, config.getQuery().getMaxResultsLimit());
    }

    @Test
    void shouldOverlayPartialYamlOnDefaults() throws IOException {
        AppConfig config = yaml.readValue("""
                store:
                  path: /tmp/inbox.json
                chunking:
                  windowSize: 200
                generation:
                  provider: openai
                  endpoint: https://api.example.com/v1/chat/completions
                unknownSection:
                  ignored: true
                """, AppConfig.class);

        assertEquals("/tmp/inbox.json", config.getStore().getPath());
        assertEquals(200, config.getChunking().getWindowSize());
        assertEquals(50, config.getChunking().getOverlap());
        assertEquals("openai", config.getGeneration().getProvider());
        assertEquals("gpt-35-turbo", config.getGeneration().getModel());
        assertEquals("local", config.getEmbedding().getProvider());
    }

    @Test
    void shouldLoadBundledApplicationYaml() throws IOException {
        try (InputStream in = AppConfigTest.class.getResourceAsStream("/application.yml")) {
            assertNotNull(in);
            AppConfig config = yaml.readValue(in, AppConfig.class);

            assertEquals(".knowledge-inbox/items.json", config.getStore().getPath());
            assertEquals(384, config.getEmbedding().getDimension());
            assertEquals(10_000, config.getExtraction().getTimeoutMs());
        }
    }
}
