/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import java.util.Arrays;
import java.util.List;

/**
 * Partition of a flat parameter vector into contiguous per-trial-solution
 * sub-vectors.
 * <p>
 * Sub-vector {@code i} starts at the prefix sum of the lengths before it, so
 * {@link #concat(double[][])} is the exact inverse of {@link #split(double[])}.
 * </p>
 */
public final class ParameterLayout {

    private final int[] lengths;
    private final int[] offsets;

    private ParameterLayout(int[] lengths) {
        if (lengths.length == 0) {
            throw new IllegalArgumentException("At least one parameter block is required");
        }
        this.lengths = lengths.clone();
        this.offsets = new int[lengths.length + 1];
        for (int i = 0; i < lengths.length; i++) {
            if (lengths[i] < 0) {
                throw new IllegalArgumentException("Parameter block length must be non-negative");
            }
            offsets[i + 1] = offsets[i] + lengths[i];
        }
    }

    /**
     * Creates a layout from block lengths.
     * @param lengths Length of each sub-vector, in order
     * @return Layout
     */
    public static ParameterLayout of(int... lengths) {
        return new ParameterLayout(lengths);
    }

    /**
     * Creates a layout matching the lengths of the given parameter vectors.
     * @param blocks Parameter vectors, in order
     * @return Layout
     */
    public static ParameterLayout of(List<double[]> blocks) {
        int[] lengths = new int[blocks.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = blocks.get(i).length;
        }
        return new ParameterLayout(lengths);
    }

    /**
     * Splits a flat vector into sub-vectors.
     * <p>
     * A single-block layout returns the flat vector itself without copying.
     * </p>
     * @param flat Flat parameter vector
     * @return Sub-vectors, in order
     * @throws ParameterLengthMismatchException if the vector length differs from {@link #total()}
     */
    public double[][] split(double[] flat) {
        checkLength(flat);
        if (lengths.length == 1) {
            return new double[][]{flat};
        }
        double[][] blocks = new double[lengths.length][];
        for (int i = 0; i < lengths.length; i++) {
            blocks[i] = Arrays.copyOfRange(flat, offset(i), offset(i + 1));
        }
        return blocks;
    }

    /**
     * Concatenates sub-vectors into one flat vector.
     * @param blocks Sub-vectors, in order
     * @return Flat vector
     * @throws ParameterLengthMismatchException if a block length differs from the layout
     */
    public double[] concat(double[][] blocks) {
        if (blocks.length != lengths.length) {
            throw new ParameterLengthMismatchException(
                    "Expected " + lengths.length + " parameter blocks, got " + blocks.length);
        }
        double[] flat = new double[total()];
        for (int i = 0; i < blocks.length; i++) {
            if (blocks[i].length != lengths[i]) {
                throw new ParameterLengthMismatchException(
                        "Parameter block " + i + " has length " + blocks[i].length + ", expected " + lengths[i]);
            }
            System.arraycopy(blocks[i], 0, flat, offset(i), lengths[i]);
        }
        return flat;
    }

    /**
     * Verifies a flat vector has the total length of the layout.
     * @param flat Flat parameter vector
     * @throws ParameterLengthMismatchException on mismatch
     */
    public void checkLength(double[] flat) {
        if (flat == null || flat.length != total()) {
            throw new ParameterLengthMismatchException("Parameter vector has length "
                    + (flat == null ? 0 : flat.length) + " but blocks " + Arrays.toString(lengths)
                    + " sum to " + total());
        }
    }

    public int total() {
        return offsets[lengths.length];
    }

    public int count() {
        return lengths.length;
    }

    public int offset(int block) {
        return offsets[block];
    }

    @Override
    public String toString() {
        return "ParameterLayout" + Arrays.toString(lengths);
    }
}
