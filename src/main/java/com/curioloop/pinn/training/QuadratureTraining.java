/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.DimensionalityException;
import com.curioloop.pinn.ResidualFunction;
import com.curioloop.pinn.quadrature.CubatureIntegrator;
import com.curioloop.pinn.quadrature.QuadratureAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Training on the integral of the squared residual.
 * <p>
 * The PDE loss integrates {@code (Σ_k R_k)²} over the domain and scales it by
 * {@code 1/10^D}, D the domain dimension. The boundary loss integrates each
 * condition's squared residual over its own bounds and scales the sum by
 * {@code 1/(10^D1 * K)}, D1 the dimension of the first boundary condition and
 * K the number of conditions.
 * </p>
 * <p>
 * Each algorithm accepts domains above a minimum dimension (see
 * {@link QuadratureAlgorithm#getMinimumDimension()}); smaller domains fail in
 * {@link #validate(int)} before any point source is built.
 * </p>
 */
public final class QuadratureTraining implements TrainingStrategy {

    private static final Logger log = LoggerFactory.getLogger(QuadratureTraining.class);

    private final QuadratureAlgorithm algorithm;
    private final double relativeTolerance;
    private final double absoluteTolerance;
    private final int maxIterations;
    private final int batchSize;

    private QuadratureTraining(Builder builder) {
        this.algorithm = builder.algorithm;
        this.relativeTolerance = builder.relativeTolerance;
        this.absoluteTolerance = builder.absoluteTolerance;
        this.maxIterations = builder.maxIterations;
        this.batchSize = builder.batchSize;
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
    public static QuadratureTraining defaults() {
        return builder().build();
    }

    public QuadratureAlgorithm getAlgorithm() {
        return algorithm;
    }

    public double getRelativeTolerance() {
        return relativeTolerance;
    }

    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @Override
    public void validate(int domainDimension) {
        if (domainDimension < algorithm.getMinimumDimension()) {
            throw new DimensionalityException(algorithm + " quadrature needs a domain of at least "
                    + algorithm.getMinimumDimension() + " dimensions, got " + domainDimension);
        }
    }

    @Override
    public TrainingLosses discretize(TrainingContext context) {
        validate(context.getPdeResidual().dimension());
        TrainingSetGenerator generator = context.getGenerator();
        List<DomainBounds> boundaryBounds = generator.boundaryBounds();
        for (DomainBounds bounds : boundaryBounds) {
            if (!algorithm.supportsRegion(bounds.dimension())) {
                throw new DimensionalityException(algorithm + " quadrature cannot integrate a "
                        + bounds.dimension() + "-dimensional boundary region " + bounds);
            }
        }
        CubatureIntegrator integrator = algorithm.create(batchSize, context.getRandom());

        DomainBounds domain = generator.pdeBounds();
        QuadratureLoss pde = new QuadratureLoss(
                Collections.singletonList(context.getPdeResidual()), Collections.singletonList(domain),
                integrator, this, 1.0 / Math.pow(10, domain.dimension()), true);

        List<ResidualFunction> residuals = context.getBoundaryResiduals();
        double boundaryTau = residuals.isEmpty() ? 0.0
                : 1.0 / (Math.pow(10, boundaryBounds.get(0).dimension()) * residuals.size());
        QuadratureLoss bc = new QuadratureLoss(residuals, boundaryBounds, integrator, this, boundaryTau, false);
        log.debug("Quadrature training ({}): domain {}, {} boundary region(s)", algorithm, domain, boundaryBounds.size());
        return new TrainingLosses(pde, bc);
    }

    @Override
    public String toString() {
        return "QuadratureTraining{" +
                "algorithm=" + algorithm +
                ", relativeTolerance=" + relativeTolerance +
                ", absoluteTolerance=" + absoluteTolerance +
                ", maxIterations=" + maxIterations +
                ", batchSize=" + batchSize +
                '}';
    }

    /**
     * Builder for quadrature training.
     */
    public static final class Builder {
        private QuadratureAlgorithm algorithm = QuadratureAlgorithm.H_CUBATURE;
        private double relativeTolerance = 1e-8;
        private double absoluteTolerance = 1e-8;
        private int maxIterations = 1000;
        private int batchSize = 0;

        private Builder() {}

        /**
         * Sets the cubature algorithm.
         * @param value Algorithm
         * @return This builder
         */
        public Builder algorithm(QuadratureAlgorithm value) {
            if (value == null) {
                throw new IllegalArgumentException("Quadrature algorithm cannot be null");
            }
            this.algorithm = value;
            return this;
        }

        /**
         * Sets the relative tolerance.
         * @param value Relative tolerance (must be positive)
         * @return This builder
         */
        public Builder relativeTolerance(double value) {
            if (value <= 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Relative tolerance must be positive");
            }
            this.relativeTolerance = value;
            return this;
        }

        /**
         * Sets the absolute tolerance.
         * @param value Absolute tolerance (must be positive)
         * @return This builder
         */
        public Builder absoluteTolerance(double value) {
            if (value <= 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Absolute tolerance must be positive");
            }
            this.absoluteTolerance = value;
            return this;
        }

        /**
         * Sets the maximum number of refinement steps per integral.
         * @param value Maximum iterations (must be positive)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }

        /**
         * Sets the number of points evaluated per batch by batched algorithms.
         * @param value Batch size (0 for the algorithm default, must be non-negative)
         * @return This builder
         */
        public Builder batchSize(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Batch size must be non-negative");
            }
            this.batchSize = value;
            return this;
        }

        public QuadratureTraining build() {
            return new QuadratureTraining(this);
        }
    }
}
