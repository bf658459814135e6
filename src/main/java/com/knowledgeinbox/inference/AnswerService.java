package com.knowledgeinbox.inference;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgeinbox.ingest.EmbeddingService;
import com.knowledgeinbox.ingest.EmbeddingUnavailableException;
import com.knowledgeinbox.ingest.SearchResult;
import com.knowledgeinbox.ingest.VectorIndex;

/**
 * Answers questions from the knowledge base: embed the question, retrieve the closest chunks, and let the
 * generation model answer from them. Retrieval is deterministic for a given index; the generated wording is not.
 */
public class AnswerService {
    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    public static final int DEFAULT_MAX_RESULTS = 5;
    public static final int DEFAULT_MAX_RESULTS_LIMIT = 10;

    private final EmbeddingService embeddingService;
    private final VectorIndex index;
    private final InferenceEngine inferenceEngine;
    private final int maxResultsLimit;

    public AnswerService(EmbeddingService embeddingService, VectorIndex index, InferenceEngine inferenceEngine) {
        this(embeddingService, index, inferenceEngine, DEFAULT_MAX_RESULTS_LIMIT);
    }

    public AnswerService(EmbeddingService embeddingService,
            VectorIndex index,
            InferenceEngine inferenceEngine,
            int maxResultsLimit) {
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.index = Objects.requireNonNull(index, "index");
        this.inferenceEngine = Objects.requireNonNull(inferenceEngine, "inferenceEngine");
        if (maxResultsLimit <= 0) {
            throw new IllegalArgumentException("maxResultsLimit must be positive");
        }
        this.maxResultsLimit = maxResultsLimit;
    }

    public Answer answer(String question) {
        return answer(question, DEFAULT_MAX_RESULTS);
    }

    public Answer answer(String question, int maxResults) {
        if (question == null || question.isBlank()) {
            throw new InvalidQueryException("Question cannot be empty");
        }
        if (maxResults < 1 || maxResults > maxResultsLimit) {
            throw new InvalidQueryException("maxResults must be between 1 and " + maxResultsLimit);
        }
        String normalizedQuestion = question.strip();

        long retrievalStart = System.nanoTime();
        List<float[]> embedded = embeddingService.embed(List.of(normalizedQuestion));
        if (embedded.size() != 1) {
            throw new EmbeddingUnavailableException("Expected 1 embedding for the question but received "
                    + embedded.size());
        }
        float[] questionEmbedding = embedded.get(0);
        List<SearchResult> sources = index.search(questionEmbedding, maxResults);
        long retrievalMs = (System.nanoTime() - retrievalStart) / 1_000_000;
        if (sources.isEmpty()) {
            log.warn("No indexed chunks matched; answering without sources");
        }

        String context = GroundedPromptTemplate.groundingContext(sources);
        InferenceRequest request = new InferenceRequest(
                GroundedPromptTemplate.systemPolicy(),
                GroundedPromptTemplate.userPrompt(normalizedQuestion, context),
                normalizedQuestion,
                sources);

        long generationStart = System.nanoTime();
        String text = inferenceEngine.generate(request);
        if (text == null) {
            throw new GenerationUnavailableException("Generation model returned no answer");
        }
        long generationMs = (System.nanoTime() - generationStart) / 1_000_000;

        List<Citation> citations = sources.stream().map(Citation::from).toList();
        log.info("Answered question with {} citations retrievalMs={} generationMs={}",
                citations.size(), retrievalMs, generationMs);
        return new Answer(normalizedQuestion, text, citations);
    }
}
