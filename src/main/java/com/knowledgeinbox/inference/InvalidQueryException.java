package com.knowledgeinbox.inference;

import com.knowledgeinbox.FailureKind;
import com.knowledgeinbox.KnowledgeInboxException;

public class InvalidQueryException extends KnowledgeInboxException {
    public InvalidQueryException(String message) {
        super(FailureKind.INVALID_QUERY, message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(FailureKind.INVALID_QUERY, message, cause);
    }
}
