package com.knowledgeinbox.store;

public record ItemDraft(SourceKind sourceKind, String originUrl, String rawText) {

    public static ItemDraft note(String text) {
        return new ItemDraft(SourceKind.NOTE, null, text);
    }

    public static ItemDraft url(String url, String extractedText) {
        return new ItemDraft(SourceKind.URL, url, extractedText);
    }
}
