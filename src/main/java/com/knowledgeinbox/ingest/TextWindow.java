package com.knowledgeinbox.ingest;

public record TextWindow(String text, int startOffset, int endOffset) {
}
