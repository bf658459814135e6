package com.knowledgeinbox.store;

import java.time.Instant;
import java.util.Objects;

public record Item(
        long id,
        SourceKind sourceKind,
        String originUrl,
        String rawText,
        Instant createdAt) {

    public Item {
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(createdAt, "createdAt");
        if ((sourceKind == SourceKind.URL) != (originUrl != null)) {
            throw new IllegalArgumentException("originUrl must be set exactly for url items");
        }
    }
}
