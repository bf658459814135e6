package com.knowledgeinbox.ingest;

public record RebuildReport(int indexedItems, int indexedChunks, long elapsedMs) {
}
