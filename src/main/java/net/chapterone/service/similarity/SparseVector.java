package net.chapterone.service.similarity;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable sparse vector over vocabulary term indices, indices strictly ascending.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

    private final int[] indices;
    private final double[] values;

    private SparseVector(int[] indices, double[] values) {
        this.indices = indices;
        this.values = values;
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    /**
     * Builds a vector from term index to weight; zero weights are dropped.
     */
    public static SparseVector of(Map<Integer, Double> weights) {
        TreeMap<Integer, Double> sorted = new TreeMap<>(weights);
        sorted.values().removeIf(value -> value == null || value == 0.0);
        int[] indices = new int[sorted.size()];
        double[] values = new double[sorted.size()];
        int position = 0;
        for (Map.Entry<Integer, Double> entry : sorted.entrySet()) {
            indices[position] = entry.getKey();
            values[position] = entry.getValue();
            position++;
        }
        return new SparseVector(indices, values);
    }

    public int size() {
        return indices.length;
    }

    public double norm() {
        double sum = 0.0;
        for (double value : values) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    public boolean isZero() {
        return norm() == 0.0;
    }

    /** Returns a unit-length copy, or this vector when its norm is zero. */
    public SparseVector normalized() {
        double norm = norm();
        if (norm == 0.0) {
            return this;
        }
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] / norm;
        }
        return new SparseVector(indices, scaled);
    }

    public double dot(SparseVector other) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += values[i] * other.values[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseVector other)) {
            return false;
        }
        return Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }
}
