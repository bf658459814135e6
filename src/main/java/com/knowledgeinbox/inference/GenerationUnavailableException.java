package com.knowledgeinbox.inference;

import com.knowledgeinbox.FailureKind;
import com.knowledgeinbox.KnowledgeInboxException;

public class GenerationUnavailableException extends KnowledgeInboxException {
    public GenerationUnavailableException(String message) {
        super(FailureKind.GENERATION_UNAVAILABLE, message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(FailureKind.GENERATION_UNAVAILABLE, message, cause);
    }
}
