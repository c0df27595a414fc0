/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import org.apache.commons.math3.random.HaltonSequenceGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomVectorGenerator;
import org.apache.commons.math3.random.SobolSequenceGenerator;

/**
 * Point sampling schemes for quasi-random training.
 * <p>
 * All methods produce points in the unit cube; {@link QuasiRandomSampler}
 * scales them into the target bounds.
 * </p>
 */
public enum SamplingMethod {

    /** Independent uniform draws. */
    UNIFORM(false) {
        @Override
        double[][] unitSample(int count, int dimension, RandomGenerator random) {
            double[][] points = new double[count][dimension];
            for (double[] p : points) {
                for (int i = 0; i < dimension; i++) {
                    p[i] = random.nextDouble();
                }
            }
            return points;
        }
    },

    /** Sobol low-discrepancy sequence, origin skipped. */
    SOBOL(true) {
        @Override
        double[][] unitSample(int count, int dimension, RandomGenerator random) {
            return sequence(new SobolSequenceGenerator(dimension), count);
        }
    },

    /** Halton low-discrepancy sequence, origin skipped. */
    HALTON(true) {
        @Override
        double[][] unitSample(int count, int dimension, RandomGenerator random) {
            return sequence(new HaltonSequenceGenerator(dimension), count);
        }
    },

    /** Latin hypercube: one point per stratum along every axis. */
    LATIN_HYPERCUBE(false) {
        @Override
        double[][] unitSample(int count, int dimension, RandomGenerator random) {
            double[][] points = new double[count][dimension];
            int[] strata = new int[count];
            for (int axis = 0; axis < dimension; axis++) {
                for (int i = 0; i < count; i++) {
                    strata[i] = i;
                }
                for (int i = count - 1; i > 0; i--) {
                    int j = random.nextInt(i + 1);
                    int tmp = strata[i];
                    strata[i] = strata[j];
                    strata[j] = tmp;
                }
                for (int i = 0; i < count; i++) {
                    points[i][axis] = (strata[i] + random.nextDouble()) / count;
                }
            }
            return points;
        }
    };

    private final boolean deterministic;

    SamplingMethod(boolean deterministic) {
        this.deterministic = deterministic;
    }

    /**
     * Samples points in the unit cube.
     * @param count Number of points
     * @param dimension Point dimension (positive)
     * @param random Random source (unused by deterministic sequences)
     * @return One point per row
     */
    abstract double[][] unitSample(int count, int dimension, RandomGenerator random);

    /**
     * Checks whether the method is a deterministic sequence.
     * <p>
     * Minibatches of a deterministic sequence are consecutive chunks of one
     * stream; other methods sample each minibatch independently.
     * </p>
     * @return true for low-discrepancy sequences
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    private static double[][] sequence(RandomVectorGenerator generator, int count) {
        generator.nextVector();
        double[][] points = new double[count][];
        for (int i = 0; i < count; i++) {
            points[i] = generator.nextVector();
        }
        return points;
    }
}
