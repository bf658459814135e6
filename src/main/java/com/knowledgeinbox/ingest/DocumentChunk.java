package com.knowledgeinbox.ingest;

import com.knowledgeinbox.store.Item;

public record DocumentChunk(String id, String text, ChunkMetadata metadata) {

    static DocumentChunk of(Item item, int chunkIndex, TextWindow window) {
        ChunkMetadata metadata = new ChunkMetadata(
                item.id(),
                item.sourceKind(),
                item.originUrl(),
                chunkIndex,
                window.startOffset(),
                window.endOffset());
        return new DocumentChunk(item.id() + "#" + chunkIndex, window.text(), metadata);
    }

    public long itemId() {
        return metadata.itemId();
    }
}
