package com.knowledgeinbox.ingest;

import com.knowledgeinbox.FailureKind;
import com.knowledgeinbox.KnowledgeInboxException;

public class EmbeddingUnavailableException extends KnowledgeInboxException {
    public EmbeddingUnavailableException(String message) {
        super(FailureKind.EMBEDDING_UNAVAILABLE, message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(FailureKind.EMBEDDING_UNAVAILABLE, message, cause);
    }
}
