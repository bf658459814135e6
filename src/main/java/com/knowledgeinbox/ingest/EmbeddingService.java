package com.knowledgeinbox.ingest;

import java.util.List;

/**
 * Turns texts into fixed-dimension vectors, one per input text and in input order. Implementations raise
 * {@link EmbeddingUnavailableException} for any provider or transport failure and never substitute a fallback
 * vector.
 */
public interface EmbeddingService {
    List<float[]> embed(List<String> texts);

    int dimension();
}
