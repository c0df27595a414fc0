/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws {@code count} fresh uniform points in a box per call.
 */
final class UniformSampler implements PointSampler {

    private final DomainBounds bounds;
    private final int count;
    private final RandomGenerator random;

    UniformSampler(DomainBounds bounds, int count, RandomGenerator random) {
        this.bounds = bounds;
        this.count = count;
        this.random = random;
    }

    @Override
    public double[][] draw() {
        int dim = bounds.dimension();
        double[][] points = new double[count][dim];
        for (double[] p : points) {
            for (int i = 0; i < dim; i++) {
                p[i] = bounds.lower(i) + (bounds.upper(i) - bounds.lower(i)) * random.nextDouble();
            }
        }
        return points;
    }
}
