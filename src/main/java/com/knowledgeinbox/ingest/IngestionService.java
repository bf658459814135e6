package com.knowledgeinbox.ingest;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgeinbox.store.Item;
import com.knowledgeinbox.store.ItemDraft;
import com.knowledgeinbox.store.ItemStore;
import com.knowledgeinbox.store.SourceKind;

/**
 * Writes items into the record store and their chunk embeddings into the vector index. An item is either fully
 * stored and indexed or not visible at all.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    public static final int DEFAULT_MAX_NOTE_LENGTH = 50_000;

    private final ItemStore itemStore;
    private final PageTextExtractor pageTextExtractor;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndex index;
    private final int maxNoteLength;

    public IngestionService(ItemStore itemStore,
            PageTextExtractor pageTextExtractor,
            Chunker chunker,
            EmbeddingService embeddingService,
            VectorIndex index) {
        this(itemStore, pageTextExtractor, chunker, embeddingService, index, DEFAULT_MAX_NOTE_LENGTH);
    }

    public IngestionService(ItemStore itemStore,
            PageTextExtractor pageTextExtractor,
            Chunker chunker,
            EmbeddingService embeddingService,
            VectorIndex index,
            int maxNoteLength) {
        this.itemStore = Objects.requireNonNull(itemStore, "itemStore");
        this.pageTextExtractor = Objects.requireNonNull(pageTextExtractor, "pageTextExtractor");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.index = Objects.requireNonNull(index, "index");
        if (embeddingService.dimension() != index.dimension()) {
            throw new IllegalArgumentException("Embedding dimension " + embeddingService.dimension()
                    + " does not match index dimension " + index.dimension());
        }
        this.maxNoteLength = maxNoteLength;
    }

    public Item ingest(SourceKind sourceKind, String content) throws IOException {
        Objects.requireNonNull(sourceKind, "sourceKind");
        ItemDraft draft = switch (sourceKind) {
            case NOTE -> ItemDraft.note(validateNote(content));
            case URL -> {
                String url = validateUrl(content);
                yield ItemDraft.url(url, pageTextExtractor.extract(url));
            }
        };

        Item item = itemStore.create(draft);
        int chunkCount;
        try {
            chunkCount = indexItem(item);
        } catch (RuntimeException e) {
            rollback(item, e);
            throw e;
        }
        if (itemStore.get(item.id()).isEmpty()) {
            // deleted concurrently, possibly before these chunks were inserted
            int removed = index.removeByItem(item.id());
            log.info("Item {} was deleted during ingestion; dropped {} chunks", item.id(), removed);
            return item;
        }
        log.info("Ingested {} item {} with {} chunks", item.sourceKind().wireName(), item.id(), chunkCount);
        return item;
    }

    /**
     * Removes the item from the store, then its chunks from the index. A store failure leaves the index untouched
     * so the call can be retried.
     *
     * @return {@code false} when the store held no such item
     */
    public boolean delete(long itemId) throws IOException {
        boolean deleted = itemStore.delete(itemId);
        int removedChunks = index.removeByItem(itemId);
        if (deleted) {
            log.info("Deleted item {} and {} indexed chunks", itemId, removedChunks);
        } else {
            log.info("Item {} not found for deletion", itemId);
        }
        return deleted;
    }

    /**
     * Re-embeds every stored item. A failure removes whatever this call already indexed, so the rebuild can be
     * retried.
     */
    public RebuildReport rebuildIndex() throws IOException {
        long start = System.nanoTime();
        List<Item> items = itemStore.list(null);
        List<Long> indexedIds = new ArrayList<>(items.size());
        int chunks = 0;
        try {
            for (Item item : items) {
                chunks += indexItem(item);
                indexedIds.add(item.id());
            }
        } catch (RuntimeException e) {
            log.warn("Rebuild failed after {} of {} items ({}); clearing partial index", indexedIds.size(),
                    items.size(), e.getMessage());
            indexedIds.forEach(index::removeByItem);
            throw e;
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.info("Rebuilt vector index from store: items={} chunks={} elapsedMs={}", items.size(), chunks, elapsedMs);
        return new RebuildReport(items.size(), chunks, elapsedMs);
    }

    private int indexItem(Item item) {
        List<TextWindow> windows = chunker.chunk(item.rawText());
        if (windows.isEmpty()) {
            throw new IllegalStateException("Item " + item.id() + " produced no chunks");
        }
        List<DocumentChunk> chunks = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            chunks.add(DocumentChunk.of(item, i, windows.get(i)));
        }

        List<float[]> embeddings = embeddingService.embed(chunks.stream().map(DocumentChunk::text).toList());
        if (embeddings.size() != chunks.size()) {
            throw new EmbeddingUnavailableException("Expected " + chunks.size() + " embeddings for item " + item.id()
                    + " but received " + embeddings.size());
        }

        List<VectorIndex.Entry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            entries.add(new VectorIndex.Entry(chunks.get(i), embeddings.get(i)));
        }
        index.insertAll(entries);
        return entries.size();
    }

    private void rollback(Item item, RuntimeException cause) {
        log.warn("Indexing item {} failed ({}); removing it from the store", item.id(), cause.getMessage());
        try {
            itemStore.delete(item.id());
        } catch (IOException | RuntimeException rollbackFailure) {
            log.error("Rollback of item {} failed", item.id(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }

    private String validateNote(String content) {
        if (content == null || content.isBlank()) {
            throw new InvalidContentException("Note content cannot be empty");
        }
        if (content.length() > maxNoteLength) {
            throw new InvalidContentException("Note content too long (max " + maxNoteLength + " characters)");
        }
        return content;
    }

    private static String validateUrl(String content) {
        if (content == null || content.isBlank()) {
            throw new InvalidContentException("URL cannot be empty");
        }
        String url = content.strip();
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new InvalidContentException("URL must start with http:// or https://: " + url);
            }
        } catch (URISyntaxException e) {
            throw new InvalidContentException("Malformed URL: " + url, e);
        }
        return url;
    }
}
