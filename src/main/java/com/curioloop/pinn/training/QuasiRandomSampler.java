/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;

/**
 * Generates minibatches of design points inside a box.
 */
public final class QuasiRandomSampler {

    private QuasiRandomSampler() {}

    /**
     * Generates design matrices.
     * <p>
     * A zero-dimensional box yields {@code pointCount} empty coordinate vectors
     * per minibatch.
     * </p>
     * @param method Sampling method
     * @param pointCount Points per minibatch
     * @param bounds Target box
     * @param minibatches Number of minibatches
     * @param random Random source
     * @return {@code minibatches} matrices of {@code pointCount} points each
     */
    public static double[][][] designMatrices(SamplingMethod method, int pointCount, DomainBounds bounds,
                                              int minibatches, RandomGenerator random) {
        if (pointCount <= 0) {
            throw new IllegalArgumentException("Point count must be positive");
        }
        if (minibatches <= 0) {
            throw new IllegalArgumentException("Minibatch count must be positive");
        }
        int dim = bounds.dimension();
        double[][][] batches = new double[minibatches][][];
        if (dim == 0) {
            for (int b = 0; b < minibatches; b++) {
                batches[b] = new double[pointCount][0];
            }
            return batches;
        }
        if (method.isDeterministic()) {
            double[][] stream = method.unitSample(Math.multiplyExact(pointCount, minibatches), dim, random);
            for (int b = 0; b < minibatches; b++) {
                batches[b] = Arrays.copyOfRange(stream, b * pointCount, (b + 1) * pointCount);
            }
        } else {
            for (int b = 0; b < minibatches; b++) {
                batches[b] = method.unitSample(pointCount, dim, random);
            }
        }
        for (double[][] batch : batches) {
            for (int i = 0; i < batch.length; i++) {
                batch[i] = bounds.scale(batch[i]);
            }
        }
        return batches;
    }
}
