package com.knowledgeinbox.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.knowledgeinbox.store.Item;
import com.knowledgeinbox.store.SourceKind;

class InMemoryVectorIndexTest {

    @Test
    void shouldReturnEmptyResultForEmptyIndex() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(3);

        assertTrue(index.search(new float[] { 1f, 0f, 0f }, 5).isEmpty());
    }

    @Test
    void shouldReturnAllEntriesSortedWhenTopKExceedsSize() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        index.insert(chunk(1, 0), new float[] { 0f, 1f });
        index.insert(chunk(2, 0), new float[] { 1f, 0f });
        index.insert(chunk(3, 0), new float[] { 1f, 1f });

        List<SearchResult> results = index.search(new float[] { 1f, 0f }, 10);

        assertEquals(3, results.size());
        assertEquals(List.of("2#0", "3#0", "1#0"), results.stream().map(result -> result.chunk().id()).toList());
        assertEquals(1f, results.get(0).score(), 1e-6f);
        assertEquals(0f, results.get(2).score(), 1e-6f);
    }

    @Test
    void shouldLimitResultsToTopK() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        for (int i = 1; i <= 6; i++) {
            index.insert(chunk(i, 0), new float[] { i, 1f });
        }

        assertEquals(2, index.search(new float[] { 1f, 0f }, 2).size());
        assertTrue(index.search(new float[] { 1f, 0f }, 0).isEmpty());
    }

    @Test
    void shouldBreakTiesByInsertionOrder() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        index.insert(chunk(7, 0), new float[] { 2f, 0f });
        index.insert(chunk(3, 0), new float[] { 1f, 0f });
        index.insert(chunk(5, 0), new float[] { 4f, 0f });

        List<SearchResult> results = index.search(new float[] { 1f, 0f }, 3);

        assertEquals(List.of("7#0", "3#0", "5#0"), results.stream().map(result -> result.chunk().id()).toList());
    }

    @Test
    void shouldScoreVectorAgainstItselfAsOne() {
        float[] vector = { 0.3f, -1.2f, 4.5f };

        assertEquals(1f, InMemoryVectorIndex.cosine(vector, vector), 1e-6f);
    }

    @Test
    void shouldScoreZeroNormVectorAsZero() {
        assertEquals(0f, InMemoryVectorIndex.cosine(new float[] { 0f, 0f }, new float[] { 1f, 1f }));
        assertEquals(0f, InMemoryVectorIndex.cosine(new float[] { 1f, 1f }, new float[] { 0f, 0f }));
    }

    @Test
    void shouldNeverReturnChunksOfRemovedItem() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        index.insert(chunk(1, 0), new float[] { 1f, 0f });
        index.insert(chunk(1, 1), new float[] { 1f, 0.1f });
        index.insert(chunk(2, 0), new float[] { 0f, 1f });

        assertEquals(2, index.removeByItem(1));

        List<SearchResult> results = index.search(new float[] { 1f, 0f }, 10);
        assertEquals(1, results.size());
        assertTrue(results.stream().noneMatch(result -> result.chunk().itemId() == 1));
        assertEquals(0, index.removeByItem(1));
        assertEquals(1, index.size());
    }

    @Test
    void shouldRejectDuplicateChunkIds() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        index.insert(chunk(1, 0), new float[] { 1f, 0f });

        assertThrows(IllegalStateException.class, () -> index.insert(chunk(1, 0), new float[] { 0f, 1f }));
        assertEquals(1, index.size());
    }

    @Test
    void shouldRejectWholeBatchWhenOneEntryIsInvalid() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        List<VectorIndex.Entry> batch = List.of(
                new VectorIndex.Entry(chunk(4, 0), new float[] { 1f, 0f }),
                new VectorIndex.Entry(chunk(4, 1), new float[] { 1f, 0f, 0f }));

        assertThrows(IllegalStateException.class, () -> index.insertAll(batch));
        assertEquals(0, index.size());
    }

    @Test
    void shouldRejectQueryWithWrongDimension() {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);

        assertThrows(IllegalStateException.class, () -> index.search(new float[] { 1f }, 1));
    }

    @Test
    void shouldAllowConcurrentSearchesWhileInserting() throws Exception {
        InMemoryVectorIndex index = new InMemoryVectorIndex(2);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = executor.submit(() -> {
                start.await();
                for (int item = 1; item <= 200; item++) {
                    index.insertAll(List.of(
                            new VectorIndex.Entry(chunk(item, 0), new float[] { 1f, item }),
                            new VectorIndex.Entry(chunk(item, 1), new float[] { item, 1f })));
                }
                return null;
            });
            Future<?> reader = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    int size = index.search(new float[] { 1f, 1f }, 1_000).size();
                    assertEquals(0, size % 2, "search observed a partially inserted item");
                }
                return null;
            });
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            reader.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(400, index.size());
    }

    static DocumentChunk chunk(long itemId, int chunkIndex) {
        Item item = new Item(itemId, SourceKind.NOTE, null, "item " + itemId, Instant.EPOCH);
        return DocumentChunk.of(item, chunkIndex, new TextWindow("chunk " + itemId + "/" + chunkIndex, 0, 1));
    }
}
