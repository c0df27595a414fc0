/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.ResidualFunction;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Training on pre-generated low-discrepancy minibatches.
 * <p>
 * At discretization time every loss term generates {@code minibatchCount}
 * design matrices of {@code pointCount} points in its own bounds. Each
 * evaluation picks one matrix per term uniformly at random. Boundary terms use
 * the rescaled point count from {@link TrainingContext#boundaryPointCount(int)}
 * with the same sampling method and minibatch count.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * QuasiRandomTraining strategy = QuasiRandomTraining.builder()
 *     .pointCount(200)
 *     .sampling(SamplingMethod.SOBOL)
 *     .minibatchCount(20)
 *     .build();
 * }</pre>
 */
public final class QuasiRandomTraining implements TrainingStrategy {

    private static final Logger log = LoggerFactory.getLogger(QuasiRandomTraining.class);

    private final int pointCount;
    private final SamplingMethod sampling;
    private final int minibatchCount;

    private QuasiRandomTraining(Builder builder) {
        this.pointCount = builder.pointCount;
        this.sampling = builder.sampling;
        this.minibatchCount = builder.minibatchCount;
    }

    /**
     * Creates a new builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a strategy with default settings.
     * @return Strategy
     */
    public static QuasiRandomTraining defaults() {
        return builder().build();
    }

    /**
     * Gets a copy of this strategy with another point count.
     * @param count Points per minibatch
     * @return Strategy with the same sampling method and minibatch count
     */
    public QuasiRandomTraining withPointCount(int count) {
        return builder().pointCount(count).sampling(sampling).minibatchCount(minibatchCount).build();
    }

    public int getPointCount() {
        return pointCount;
    }

    public SamplingMethod getSampling() {
        return sampling;
    }

    public int getMinibatchCount() {
        return minibatchCount;
    }

    @Override
    public TrainingLosses discretize(TrainingContext context) {
        TrainingSetGenerator generator = context.getGenerator();
        RandomGenerator random = context.getRandom();
        SampledLoss pde = new SampledLoss(
                Collections.singletonList(context.getPdeResidual()),
                Collections.<PointSampler>singletonList(sampler(generator.pdeBounds(), random)),
                1.0 / pointCount, true);

        QuasiRandomTraining boundary = withPointCount(context.boundaryPointCount(pointCount));
        List<ResidualFunction> residuals = context.getBoundaryResiduals();
        List<DomainBounds> bounds = generator.boundaryBounds();
        List<PointSampler> samplers = new ArrayList<>(residuals.size());
        for (int i = 0; i < residuals.size(); i++) {
            samplers.add(boundary.sampler(bounds.get(i), random));
        }
        log.debug("Quasi-random training ({}): {} domain points, {} points per boundary condition, {} minibatches",
                sampling, pointCount, boundary.pointCount, minibatchCount);
        SampledLoss bc = new SampledLoss(residuals, samplers, 1.0 / boundary.pointCount, false);
        return new TrainingLosses(pde, bc);
    }

    private MinibatchSampler sampler(DomainBounds bounds, RandomGenerator random) {
        double[][][] batches = QuasiRandomSampler.designMatrices(sampling, pointCount, bounds, minibatchCount, random);
        return new MinibatchSampler(batches, random);
    }

    @Override
    public String toString() {
        return "QuasiRandomTraining{" +
                "pointCount=" + pointCount +
                ", sampling=" + sampling +
                ", minibatchCount=" + minibatchCount +
                '}';
    }

    /**
     * Builder for quasi-random training.
     */
    public static final class Builder {
        private int pointCount = 100;
        private SamplingMethod sampling = SamplingMethod.UNIFORM;
        private int minibatchCount = 10;

        private Builder() {}

        /**
         * Sets the number of points per minibatch.
         * @param value Point count (must be positive)
         * @return This builder
         */
        public Builder pointCount(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Point count must be positive");
            }
            this.pointCount = value;
            return this;
        }

        /**
         * Sets the sampling method.
         * @param value Sampling method
         * @return This builder
         */
        public Builder sampling(SamplingMethod value) {
            if (value == null) {
                throw new IllegalArgumentException("Sampling method cannot be null");
            }
            this.sampling = value;
            return this;
        }

        /**
         * Sets the number of pre-generated minibatches.
         * @param value Minibatch count (must be positive)
         * @return This builder
         */
        public Builder minibatchCount(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Minibatch count must be positive");
            }
            this.minibatchCount = value;
            return this;
        }

        public QuasiRandomTraining build() {
            return new QuasiRandomTraining(this);
        }
    }
}
