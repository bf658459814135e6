package com.knowledgeinbox.runtime;

import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgeinbox.KnowledgeInbox;
import com.knowledgeinbox.inference.AnswerService;
import com.knowledgeinbox.inference.InferenceEngine;
import com.knowledgeinbox.inference.InferenceEngines;
import com.knowledgeinbox.ingest.Chunker;
import com.knowledgeinbox.ingest.EmbeddingService;
import com.knowledgeinbox.ingest.EmbeddingServices;
import com.knowledgeinbox.ingest.HttpPageTextExtractor;
import com.knowledgeinbox.ingest.InMemoryVectorIndex;
import com.knowledgeinbox.ingest.IngestionService;
import com.knowledgeinbox.ingest.PageTextExtractor;
import com.knowledgeinbox.ingest.VectorIndex;
import com.knowledgeinbox.store.ItemStore;
import com.knowledgeinbox.store.JsonFileItemStore;

import okhttp3.OkHttpClient;

public final class KnowledgeInboxFactory {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeInboxFactory.class);

    private KnowledgeInboxFactory() {
    }

    public static KnowledgeInbox create(AppConfig config, OkHttpClient httpClient) {
        ItemStore itemStore = new JsonFileItemStore(Path.of(config.getStore().getPath()));
        EmbeddingService embeddingService = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient);
        InferenceEngine inferenceEngine = InferenceEngines.fromConfig(config.getGeneration(), httpClient);
        PageTextExtractor extractor = new HttpPageTextExtractor(
                httpClient,
                Duration.ofMillis(config.getExtraction().getTimeoutMs()),
                config.getExtraction().getUserAgent());
        return create(config, itemStore, embeddingService, inferenceEngine, extractor);
    }

    public static KnowledgeInbox create(AppConfig config,
            ItemStore itemStore,
            EmbeddingService embeddingService,
            InferenceEngine inferenceEngine,
            PageTextExtractor extractor) {
        VectorIndex index = new InMemoryVectorIndex(embeddingService.dimension());
        Chunker chunker = new Chunker(config.getChunking().getWindowSize(), config.getChunking().getOverlap());
        IngestionService ingestionService = new IngestionService(
                itemStore,
                extractor,
                chunker,
                embeddingService,
                index,
                config.getIngestion().getMaxNoteLength());
        AnswerService answerService = new AnswerService(
                embeddingService,
                index,
                inferenceEngine,
                config.getQuery().getMaxResultsLimit());
        log.info("Knowledge inbox wired store={} embedding={} generation={} window={} overlap={}",
                config.getStore().getPath(),
                config.getEmbedding().getProvider(),
                config.getGeneration().getProvider(),
                chunker.windowSize(),
                chunker.overlap());
        return new KnowledgeInbox(itemStore, index, ingestionService, answerService);
    }
}
