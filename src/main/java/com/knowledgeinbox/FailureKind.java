package com.knowledgeinbox;

public enum FailureKind {
    INVALID_CONTENT(false),
    INVALID_QUERY(false),
    EXTRACTION_FAILED(false),
    EMBEDDING_UNAVAILABLE(true),
    GENERATION_UNAVAILABLE(true);

    private final boolean providerFailure;

    FailureKind(boolean providerFailure) {
        this.providerFailure = providerFailure;
    }

    public boolean isProviderFailure() {
        return providerFailure;
    }
}
