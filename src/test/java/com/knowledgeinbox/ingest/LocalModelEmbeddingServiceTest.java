package com.knowledgeinbox.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class LocalModelEmbeddingServiceTest {

    private final LocalModelEmbeddingService service = new LocalModelEmbeddingService(384);

    @Test
    void shouldEmbedBatchInInputOrder() {
        List<float[]> vectors = service.embed(List.of("first text", "second text", "first text"));

        assertEquals(3, vectors.size());
        assertArrayEquals(vectors.get(0), vectors.get(2));
        assertEquals(384, vectors.get(1).length);
    }

    @Test
    void shouldReturnEmptyListForEmptyBatch() {
        assertTrue(service.embed(List.of()).isEmpty());
    }

    @Test
    void shouldRankOverlappingTextHigher() {
        float[] question = vector("What color is the sky?");
        float[] sky = vector("The sky is blue.");
        float[] cats = vector("Cats are mammals.");

        assertTrue(InMemoryVectorIndex.cosine(question, sky) > InMemoryVectorIndex.cosine(question, cats));
    }

    @Test
    void shouldReturnZeroVectorForBlankText() {
        float[] blank = vector("   ");

        for (float value : blank) {
            assertEquals(0f, value);
        }
    }

    private float[] vector(String text) {
        return service.embed(List.of(text)).get(0);
    }
}
