package com.knowledgeinbox;

public record InboxStats(int itemCount, int indexedChunks) {
}
