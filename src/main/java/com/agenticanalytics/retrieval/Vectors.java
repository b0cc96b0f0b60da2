package com.agenticanalytics.retrieval;

public final class Vectors {
    private Vectors() {
    }

    public static float dot(float[] a, float[] b) {
        float dot = 0f;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    public static float norm(float[] vector) {
        double sum = 0d;
        for (float value : vector) {
            sum += value * value;
        }
        return (float) Math.sqrt(sum);
    }

    // same arithmetic as a pre-normalized matrix row, so exact and inner-product scores agree bit for bit
    public static float cosine(float[] a, float[] b) {
        return dot(normalized(a), normalized(b));
    }

    public static float[] normalized(float[] vector) {
        float[] copy = vector.clone();
        float norm = norm(copy);
        if (norm == 0f) {
            return copy;
        }
        for (int i = 0; i < copy.length; i++) {
            copy[i] /= norm;
        }
        return copy;
    }
}
