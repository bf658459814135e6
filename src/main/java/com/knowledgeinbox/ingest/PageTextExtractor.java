package com.knowledgeinbox.ingest;

public interface PageTextExtractor {
    String extract(String url);
}
