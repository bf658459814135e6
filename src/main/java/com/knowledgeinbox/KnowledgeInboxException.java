package com.knowledgeinbox;

import java.util.Objects;

public abstract class KnowledgeInboxException extends RuntimeException {
    private final FailureKind kind;

    protected KnowledgeInboxException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected KnowledgeInboxException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
