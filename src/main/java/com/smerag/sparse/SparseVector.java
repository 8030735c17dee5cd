package com.smerag.sparse;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SparseVector(int[] indices, float[] values) {
    public SparseVector {
        if (indices.length != values.length) {
            throw new IllegalArgumentException("indices and values differ in length: " + indices.length + " vs " + values.length);
        }
    }

    public static SparseVector empty() {
        return new SparseVector(new int[0], new float[0]);
    }

    public static SparseVector of(SortedMap<Integer, Float> weights) {
        int[] indices = new int[weights.size()];
        float[] values = new float[weights.size()];
        int i = 0;
        for (Map.Entry<Integer, Float> entry : weights.entrySet()) {
            indices[i] = entry.getKey();
            values[i] = entry.getValue();
            i++;
        }
        return new SparseVector(indices, values);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return indices.length == 0;
    }

    public SparseVector scale(float factor) {
        float[] scaled = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return new SparseVector(indices.clone(), scaled);
    }

    public float dot(SparseVector other) {
        if (isEmpty() || other.isEmpty()) {
            return 0f;
        }
        Map<Integer, Float> lookup = new HashMap<>();
        for (int i = 0; i < other.indices.length; i++) {
            lookup.put(other.indices[i], other.values[i]);
        }
        float sum = 0f;
        for (int i = 0; i < indices.length; i++) {
            Float weight = lookup.get(indices[i]);
            if (weight != null) {
                sum += values[i] * weight;
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SparseVector other
                && Arrays.equals(indices, other.indices)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SparseVector{nnz=" + indices.length + '}';
    }
}
