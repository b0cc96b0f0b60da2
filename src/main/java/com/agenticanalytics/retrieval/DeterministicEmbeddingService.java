package com.agenticanalytics.retrieval;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class DeterministicEmbeddingService implements EmbeddingService {
    public static final String MODEL_NAME = "deterministic-sha256";
    private final int dimension;

    public DeterministicEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(vectorFor(text));
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean isFallback() {
        return true;
    }

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    private float[] vectorFor(String text) {
        Random random = new Random(seed(text == null ? "" : text));
        float[] vector = new float[dimension];
        double norm = 0d;
        for (int i = 0; i < dimension; i++) {
            float value = (float) random.nextGaussian();
            vector[i] = value;
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0d) {
            for (int i = 0; i < dimension; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    private static long seed(String text) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
        long result = 0L;
        for (int i = 0; i < 8; i++) {
            result = (result << 8) | (digest[i] & 0xFF);
        }
        return result;
    }
}
