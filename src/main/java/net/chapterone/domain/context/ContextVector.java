package net.chapterone.domain.context;

import java.util.Arrays;

/**
 * Immutable fixed-length feature vector produced by the context encoder.
 */
public final class ContextVector {

    private final double[] values;

    private ContextVector(double[] values) {
        this.values = values;
    }

    /** Copies the supplied values; later changes to the array are not observed. */
    public static ContextVector of(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        return new ContextVector(values.clone());
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    public double norm() {
        double sum = 0.0;
        for (double value : values) {
            sum += value * value;
        }
        return StrictMath.sqrt(sum);
    }

    public double dot(ContextVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContextVector other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ContextVector" + Arrays.toString(values);
    }
}
