package com.payment.threatintel.features;

import java.util.List;

/**
 * Dense-vector helpers for feature vectors and centroids.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(double[] v) {
        double sum = 0.0;
        for (double x : v) sum += x * x;
        return Math.sqrt(sum);
    }

    /** Returns a unit-length copy; a zero vector is returned unchanged. */
    public static double[] l2Normalize(double[] v) {
        double n = norm(v);
        double[] out = v.clone();
        if (n == 0.0) return out;
        for (int i = 0; i < out.length; i++) out[i] = out[i] / n;
        return out;
    }

    /** Cosine similarity; 0 when either vector is null, zero, or the dimensions differ. */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /** Element-wise mean of equally sized vectors. */
    public static double[] mean(List<double[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty set of vectors");
        }
        int dim = vectors.get(0).length;
        double[] sum = new double[dim];
        for (double[] v : vectors) {
            if (v.length != dim) {
                throw new IllegalArgumentException("Vector dimension mismatch: " + v.length + " != " + dim);
            }
            for (int i = 0; i < dim; i++) sum[i] += v[i];
        }
        for (int i = 0; i < dim; i++) sum[i] /= vectors.size();
        return sum;
    }

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
