package com.knowledgeinbox.inference;

import java.util.List;

import com.knowledgeinbox.ingest.SearchResult;

public record InferenceRequest(
        String systemPrompt,
        String userPrompt,
        String question,
        List<SearchResult> snippets) {
}
