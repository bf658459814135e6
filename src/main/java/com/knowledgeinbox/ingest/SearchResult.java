package com.knowledgeinbox.ingest;

public record SearchResult(DocumentChunk chunk, float score) {
}
