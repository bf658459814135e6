package com.knowledgeinbox.ingest;

import com.knowledgeinbox.store.SourceKind;

public record ChunkMetadata(
        long itemId,
        SourceKind sourceKind,
        String originUrl,
        int chunkIndex,
        int startOffset,
        int endOffset) {
}
