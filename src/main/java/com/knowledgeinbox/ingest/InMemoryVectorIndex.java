package com.knowledgeinbox.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemoryVectorIndex implements VectorIndex {
    private final Map<String, IndexedChunk> chunks = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int dimension;
    private long insertionSequence;

    public InMemoryVectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public void insert(DocumentChunk chunk, float[] embedding) {
        insertAll(List.of(new Entry(chunk, embedding)));
    }

    @Override
    public void insertAll(List<Entry> entries) {
        lock.writeLock().lock();
        try {
            Set<String> batchIds = new HashSet<>();
            for (Entry entry : entries) {
                String id = entry.chunk().id();
                if (chunks.containsKey(id) || !batchIds.add(id)) {
                    throw new IllegalStateException("Chunk " + id + " is already indexed");
                }
                checkDimension(entry.embedding());
            }
            for (Entry entry : entries) {
                chunks.put(entry.chunk().id(), new IndexedChunk(entry.chunk(), entry.embedding(), insertionSequence++));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int removeByItem(long itemId) {
        lock.writeLock().lock();
        try {
            int before = chunks.size();
            chunks.values().removeIf(indexed -> indexed.chunk().itemId() == itemId);
            return before - chunks.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] queryEmbedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        checkDimension(queryEmbedding);
        List<ScoredChunk> scored;
        lock.readLock().lock();
        try {
            scored = new ArrayList<>(chunks.size());
            for (IndexedChunk indexed : chunks.values()) {
                scored.add(new ScoredChunk(indexed, cosine(queryEmbedding, indexed.embedding())));
            }
        } finally {
            lock.readLock().unlock();
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed()
                        .thenComparingLong(candidate -> candidate.indexed().sequence()))
                .limit(topK)
                .map(candidate -> new SearchResult(candidate.indexed().chunk(), candidate.score()))
                .toList();
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    static float cosine(float[] a, float[] b) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0f;
        }
        return (float) (dot / (Math.sqrt(aNorm) * Math.sqrt(bNorm)));
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalStateException("Expected a " + dimension + "-dimensional vector but got "
                    + (vector == null ? "null" : vector.length + " dimensions"));
        }
    }

    private record IndexedChunk(DocumentChunk chunk, float[] embedding, long sequence) {
    }

    private record ScoredChunk(IndexedChunk indexed, float score) {
    }
}
