package com.knowledgeinbox.ingest;

import java.util.List;

public interface VectorIndex {
    void insert(DocumentChunk chunk, float[] embedding);

    // all or nothing
    void insertAll(List<Entry> entries);

    int removeByItem(long itemId);

    // descending cosine similarity, earlier insertions first on ties
    List<SearchResult> search(float[] queryEmbedding, int topK);

    int size();

    int dimension();

    record Entry(DocumentChunk chunk, float[] embedding) {
    }
}
