package com.knowledgeinbox.inference;

import java.util.List;
import java.util.Locale;

import com.knowledgeinbox.ingest.ChunkMetadata;
import com.knowledgeinbox.ingest.SearchResult;

public final class GroundedPromptTemplate {
    static final String NO_SOURCES = "(no sources were retrieved)";

    private static final String SYSTEM_POLICY = String.join("\n",
            "You are a helpful assistant answering questions based on the user's saved knowledge base.",
            "Behavior rules:",
            "- Answer ONLY from the provided sources. Do not use outside knowledge.",
            "- Never assert facts the sources do not support.",
            "- If the sources are missing or do not contain the answer, say that no relevant information was found.",
            "- Cite the sources you used like [1], [2], matching the source numbers.",
            "- Be concise and accurate.");

    private GroundedPromptTemplate() {
    }

    public static String systemPolicy() {
        return SYSTEM_POLICY;
    }

    public static String groundingContext(List<SearchResult> sources) {
        if (sources.isEmpty()) {
            return NO_SOURCES;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < sources.size(); i++) {
            SearchResult source = sources.get(i);
            ChunkMetadata metadata = source.chunk().metadata();
            int number = i + 1;
            builder.append("[Source ").append(number).append("] kind=").append(metadata.sourceKind().wireName());
            if (metadata.originUrl() != null) {
                builder.append(" origin=").append(metadata.originUrl());
            }
            builder.append(" relevance=").append(String.format(Locale.ROOT, "%.2f", source.score()))
                    .append("\n")
                    .append(source.chunk().text().strip())
                    .append("\n[End of source ").append(number).append("]\n\n");
        }
        return builder.toString().stripTrailing();
    }

    public static String userPrompt(String question, String groundingContext) {
        return "Sources from the knowledge base:\n"
                + groundingContext
                + "\n\nQuestion: " + question
                + "\n\nAnswer the question using only the sources above and cite the ones you used.";
    }
}
