package com.knowledgeinbox.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CitationTest {

    @Test
    void shouldTruncateLongPreviews() {
        String text = "a".repeat(250);

        assertEquals("a".repeat(Citation.PREVIEW_LENGTH) + "...", Citation.preview(text));
    }

    @Test
    void shouldKeepShortPreviewsWhole() {
        assertEquals("short text", Citation.preview("  short text \n"));
    }

    @Test
    void shouldCarryChunkOriginAndScore() {
        Citation citation = Citation.from(ExtractiveInferenceEngineTest.snippet(9L, "Grass is green."));

        assertEquals(9L, citation.itemId());
        assertEquals(0.5f, citation.relevanceScore());
        assertEquals(null, citation.originUrl());
    }
}
