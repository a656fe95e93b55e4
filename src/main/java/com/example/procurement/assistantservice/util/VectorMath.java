package com.example.procurement.assistantservice.util;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Returns a unit-length copy of {@code v}.
     *
     * @throws IllegalArgumentException for an empty or zero vector
     */
    public static float[] normalize(float[] v) {
        double norm = 0;
        for (float f : v) {
            norm += (double) f * f;
        }
        norm = Math.sqrt(norm);
        if (v.length == 0 || norm == 0 || Double.isNaN(norm)) {
            throw new IllegalArgumentException("Cannot normalize a zero or empty vector");
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    // cosine that works on float[]
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb) + 1e-12);
    }

    public static List<Double> toList(float[] v) {
        List<Double> out = new ArrayList<>(v.length);
        for (float f : v) out.add((double) f);
        return out;
    }

    public static float[] toFloatArray(List<Double> list) {
        float[] a = new float[list.size()];
        for (int i = 0; i < list.size(); i++) a[i] = list.get(i).floatValue();
        return a;
    }
}
