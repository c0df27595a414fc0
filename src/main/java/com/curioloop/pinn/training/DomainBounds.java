/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import java.util.Arrays;

/**
 * Axis-aligned box {@code [lower, upper]} over the free variables of a residual.
 * A zero-dimensional box denotes a single point.
 */
public final class DomainBounds {

    private final double[] lower;
    private final double[] upper;

    public DomainBounds(double[] lower, double[] upper) {
        if (lower.length != upper.length) {
            throw new IllegalArgumentException("Lower and upper bounds must have the same dimension");
        }
        for (int i = 0; i < lower.length; i++) {
            if (lower[i] > upper[i]) {
                throw new IllegalArgumentException("Lower bound exceeds upper bound on axis " + i);
            }
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    public double[] getLower() {
        return lower.clone();
    }

    public double[] getUpper() {
        return upper.clone();
    }

    public double lower(int axis) {
        return lower[axis];
    }

    public double upper(int axis) {
        return upper[axis];
    }

    public int dimension() {
        return lower.length;
    }

    /**
     * Maps a point of the unit cube into the box.
     * @param unit Point with coordinates in [0, 1]
     * @return Scaled point
     */
    public double[] scale(double[] unit) {
        double[] point = new double[lower.length];
        for (int i = 0; i < point.length; i++) {
            point[i] = lower[i] + (upper[i] - lower[i]) * unit[i];
        }
        return point;
    }

    /**
     * Gets the box volume (1 for a zero-dimensional box).
     * @return Volume
     */
    public double volume() {
        double v = 1;
        for (int i = 0; i < lower.length; i++) {
            v *= upper[i] - lower[i];
        }
        return v;
    }

    @Override
    public String toString() {
        return "DomainBounds{lower=" + Arrays.toString(lower) + ", upper=" + Arrays.toString(upper) + "}";
    }
}
