package com.network.matching.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense vector produced by an embedding collaborator.
 * The engine only relies on its dimensionality and component values.
 */
public final class Embedding {

    private final float[] values;

    private Embedding(float[] values) {
        this.values = values;
    }

    public static Embedding of(float... values) {
        Objects.requireNonNull(values, "values are required");
        if (values.length == 0) {
            throw new IllegalArgumentException("Embedding must have at least one dimension");
        }
        return new Embedding(values.clone());
    }

    public static Embedding of(List<? extends Number> values) {
        Objects.requireNonNull(values, "values are required");
        float[] copy = new float[values.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = values.get(i).floatValue();
        }
        return of(copy);
    }

    public int dimension() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    public float[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(values, ((Embedding) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding{dimension=" + values.length + '}';
    }
}
