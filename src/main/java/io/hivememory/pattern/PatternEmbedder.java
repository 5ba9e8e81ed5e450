package io.hivememory.pattern;

import io.hivememory.core.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-features embedding.
 *
 * <p>Content is lowercased and stripped of punctuation. Each word and each adjacent
 * word pair is hashed (FNV-1a) into one of {@code dimension} buckets with a
 * hash-derived sign. The result is L2-normalized, so cosine similarity between two
 * embeddings is their dot product.</p>
 */
public class PatternEmbedder {

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;
    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimension;

    public PatternEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    public float[] embed(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Pattern content is required");
        }
        float[] vector = new float[dimension];
        List<String> tokens = tokenize(content);
        for (int i = 0; i < tokens.size(); i++) {
            add(vector, tokens.get(i), 1.0f);
            if (i > 0) {
                add(vector, tokens.get(i - 1) + " " + tokens.get(i), BIGRAM_WEIGHT);
            }
        }
        normalize(vector);
        return vector;
    }

    static List<String> tokenize(String content) {
        String cleaned = content.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ");
        List<String> tokens = new ArrayList<>();
        for (String token : cleaned.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Scales {@code vector} to unit length in place. A zero vector becomes the first
     * basis vector so every embedding has norm 1.
     */
    static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            vector[0] = 1.0f;
            return;
        }
        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= inv;
        }
    }

    public static double cosine(float[] a, float[] b) {
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    private void add(float[] vector, String feature, float weight) {
        int hash = fnv1a(feature);
        int bucket = Integer.remainderUnsigned(hash, dimension);
        vector[bucket] += (hash >>> 31) == 0 ? weight : -weight;
    }

    private static int fnv1a(String feature) {
        int hash = FNV_OFFSET;
        for (byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
