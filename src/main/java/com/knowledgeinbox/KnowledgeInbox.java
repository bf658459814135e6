package com.knowledgeinbox;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgeinbox.inference.Answer;
import com.knowledgeinbox.inference.AnswerService;
import com.knowledgeinbox.ingest.IngestionService;
import com.knowledgeinbox.ingest.RebuildReport;
import com.knowledgeinbox.ingest.VectorIndex;
import com.knowledgeinbox.store.Item;
import com.knowledgeinbox.store.ItemStore;
import com.knowledgeinbox.store.SourceKind;

/**
 * Operations offered to the request-handling shell. The vector index starts empty, so
 * {@link #rebuildIndexFromStore()} must run once before anything else is served.
 */
public class KnowledgeInbox {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeInbox.class);

    private final ItemStore itemStore;
    private final VectorIndex index;
    private final IngestionService ingestionService;
    private final AnswerService answerService;
    private volatile boolean indexReady;

    public KnowledgeInbox(ItemStore itemStore,
            VectorIndex index,
            IngestionService ingestionService,
            AnswerService answerService) {
        this.itemStore = Objects.requireNonNull(itemStore, "itemStore");
        this.index = Objects.requireNonNull(index, "index");
        this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService");
        this.answerService = Objects.requireNonNull(answerService, "answerService");
    }

    public synchronized RebuildReport rebuildIndexFromStore() throws IOException {
        if (indexReady) {
            throw new IllegalStateException("Vector index was already rebuilt");
        }
        RebuildReport report = ingestionService.rebuildIndex();
        indexReady = true;
        return report;
    }

    public Item ingest(SourceKind sourceKind, String content) throws IOException {
        requireIndexReady();
        return ingestionService.ingest(sourceKind, content);
    }

    public boolean delete(long itemId) throws IOException {
        requireIndexReady();
        return ingestionService.delete(itemId);
    }

    public Answer answer(String question) {
        requireIndexReady();
        return answerService.answer(question);
    }

    public Answer answer(String question, int maxResults) {
        requireIndexReady();
        return answerService.answer(question, maxResults);
    }

    public Optional<Item> get(long itemId) throws IOException {
        return itemStore.get(itemId);
    }

    public List<Item> list(SourceKind filter) throws IOException {
        List<Item> items = itemStore.list(filter);
        log.debug("Listed {} items (filter: {})", items.size(), filter == null ? "none" : filter.wireName());
        return items;
    }

    public InboxStats stats() throws IOException {
        return new InboxStats(itemStore.list(null).size(), index.size());
    }

    private void requireIndexReady() {
        if (!indexReady) {
            throw new IllegalStateException("Vector index has not been rebuilt from the store yet");
        }
    }
}
