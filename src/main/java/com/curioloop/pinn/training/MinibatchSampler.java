/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Picks one of several pre-generated design matrices uniformly at random per call.
 */
final class MinibatchSampler implements PointSampler {

    private final double[][][] minibatches;
    private final RandomGenerator random;

    MinibatchSampler(double[][][] minibatches, RandomGenerator random) {
        if (minibatches.length == 0) {
            throw new IllegalArgumentException("At least one minibatch is required");
        }
        this.minibatches = minibatches;
        this.random = random;
    }

    @Override
    public double[][] draw() {
        return minibatches[random.nextInt(minibatches.length)];
    }

    int minibatchCount() {
        return minibatches.length;
    }
}
