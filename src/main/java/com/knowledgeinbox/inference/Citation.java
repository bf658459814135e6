package com.knowledgeinbox.inference;

import com.knowledgeinbox.ingest.DocumentChunk;
import com.knowledgeinbox.ingest.SearchResult;
import com.knowledgeinbox.store.SourceKind;

public record Citation(DocumentChunk chunk, float relevanceScore, String preview) {
    static final int PREVIEW_LENGTH = 200;

    static Citation from(SearchResult result) {
        return new Citation(result.chunk(), result.score(), preview(result.chunk().text()));
    }

    public long itemId() {
        return chunk.itemId();
    }

    public SourceKind sourceKind() {
        return chunk.metadata().sourceKind();
    }

    public String originUrl() {
        return chunk.metadata().originUrl();
    }

    static String preview(String text) {
        String trimmed = text.strip();
        if (trimmed.length() > PREVIEW_LENGTH) {
            return trimmed.substring(0, PREVIEW_LENGTH) + "...";
        }
        return trimmed;
    }
}
