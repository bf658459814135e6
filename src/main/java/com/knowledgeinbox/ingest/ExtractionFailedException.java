package com.knowledgeinbox.ingest;

import com.knowledgeinbox.FailureKind;
import com.knowledgeinbox.KnowledgeInboxException;

public class ExtractionFailedException extends KnowledgeInboxException {
    public ExtractionFailedException(String message) {
        super(FailureKind.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(FailureKind.EXTRACTION_FAILED, message, cause);
    }
}
