package com.knowledgeinbox.inference;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.knowledgeinbox.ingest.SearchResult;

/**
 * Offline model that answers with the first source sentence sharing a keyword with the question. It never
 * composes text of its own, so it cannot state anything the sources do not contain.
 */
public class ExtractiveInferenceEngine implements InferenceEngine {
    public static final String NO_INFORMATION_ANSWER = "I don't have any relevant information to answer this question.";

    private static final Set<String> STOP_WORDS = Set.of(
            "what", "which", "who", "whom", "how", "why", "when", "where", "the", "and", "are", "was", "were",
            "does", "did", "for", "with", "about", "this", "that", "there", "have", "has", "can", "you");

    @Override
    public String generate(InferenceRequest request) {
        if (request.question() == null || request.question().isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        List<SearchResult> snippets = request.snippets();
        if (snippets.isEmpty()) {
            return NO_INFORMATION_ANSWER;
        }

        Set<String> keywords = keywords(request.question());
        for (int i = 0; i < snippets.size(); i++) {
            String sentence = firstMatchingSentence(snippets.get(i).chunk().text(), keywords);
            if (sentence != null) {
                return sentence + " [" + (i + 1) + "]";
            }
        }
        return NO_INFORMATION_ANSWER;
    }

    static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> token.length() > 2)
                .filter(token -> !STOP_WORDS.contains(token))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        if (text == null || text.isBlank() || keywords.isEmpty()) {
            return null;
        }
        for (String sentence : text.strip().split("(?<=[.!?])\\s+")) {
            Set<String> words = Arrays.stream(sentence.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                    .collect(Collectors.toSet());
            if (keywords.stream().anyMatch(words::contains)) {
                return sentence.strip();
            }
        }
        return null;
    }
}
