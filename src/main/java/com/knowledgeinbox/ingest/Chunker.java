package com.knowledgeinbox.ingest;

import java.util.ArrayList;
import java.util.List;

public class Chunker {
    public static final int DEFAULT_WINDOW_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 50;

    private final int windowSize;
    private final int overlap;

    public Chunker() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_OVERLAP);
    }

    public Chunker(int windowSize, int overlap) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        if (overlap < 0 || overlap >= windowSize) {
            throw new IllegalArgumentException("overlap must be in [0, windowSize)");
        }
        this.windowSize = windowSize;
        this.overlap = overlap;
    }

    public List<TextWindow> chunk(String text) {
        List<TextWindow> windows = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return windows;
        }

        int step = windowSize - overlap;
        int start = 0;
        while (start < text.length()) {
            int endExclusive = Math.min(text.length(), start + windowSize);
            windows.add(new TextWindow(text.substring(start, endExclusive), start, endExclusive));
            // a further window would lie entirely inside this one
            if (endExclusive == text.length()) {
                break;
            }
            start += step;
        }
        return windows;
    }

    public int windowSize() {
        return windowSize;
    }

    public int overlap() {
        return overlap;
    }
}
