package com.knowledgeinbox.ingest;

import com.knowledgeinbox.FailureKind;
import com.knowledgeinbox.KnowledgeInboxException;

public class InvalidContentException extends KnowledgeInboxException {
    public InvalidContentException(String message) {
        super(FailureKind.INVALID_CONTENT, message);
    }

    public InvalidContentException(String message, Throwable cause) {
        super(FailureKind.INVALID_CONTENT, message, cause);
    }
}
