package com.knowledgeinbox.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embedding for lexical-overlap retrieval when no provider is configured. Words, adjacent word pairs and
 * boundary-padded character trigrams are hashed into signed buckets.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final double WORD_WEIGHT = 1.0;
    private static final double PAIR_WEIGHT = 0.5;
    private static final double TRIGRAM_WEIGHT = 0.3;

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(toUnitVector(featureWeights(text)));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private double[] featureWeights(String text) {
        double[] weights = new double[dimension];
        if (text == null) {
            return weights;
        }
        String previous = null;
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            accumulate(weights, "w|" + word, WORD_WEIGHT);
            if (previous != null) {
                accumulate(weights, "p|" + previous + ' ' + word, PAIR_WEIGHT);
            }
            String padded = '^' + word + '$';
            for (int end = 3; end <= padded.length(); end++) {
                accumulate(weights, "t|" + padded.substring(end - 3, end), TRIGRAM_WEIGHT);
            }
            previous = word;
        }
        return weights;
    }

    // the low bits pick the bucket, the top bit the sign, so collisions tend to cancel instead of pile up
    private void accumulate(double[] weights, String feature, double weight) {
        int hash = feature.hashCode() * 0x9E3779B1;
        weights[Math.floorMod(hash, dimension)] += hash < 0 ? -weight : weight;
    }

    private static float[] toUnitVector(double[] weights) {
        double sumOfSquares = 0d;
        for (double weight : weights) {
            sumOfSquares += weight * weight;
        }
        float[] vector = new float[weights.length];
        if (sumOfSquares == 0d) {
            return vector;
        }
        double length = Math.sqrt(sumOfSquares);
        for (int i = 0; i < weights.length; i++) {
            vector[i] = (float) (weights[i] / length);
        }
        return vector;
    }
}
