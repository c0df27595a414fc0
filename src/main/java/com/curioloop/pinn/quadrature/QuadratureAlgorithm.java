/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Available cubature algorithms.
 * <p>
 * Each algorithm declares the smallest domain dimension it accepts and which
 * region dimensions it can integrate. A zero-dimensional region is always
 * accepted and integrates to the integrand value at that point.
 * </p>
 */
public enum QuadratureAlgorithm {

    /** h-adaptive Genz–Malik cubature, Gauss–Kronrod on intervals. */
    H_CUBATURE(2) {
        @Override
        public CubatureIntegrator create(int batchSize, RandomGenerator random) {
            return new HCubatureIntegrator(false);
        }
    },

    /** h-adaptive Genz–Malik cubature on every region. */
    GENZ_MALIK(3) {
        @Override
        public CubatureIntegrator create(int batchSize, RandomGenerator random) {
            return new HCubatureIntegrator(true);
        }

        @Override
        public boolean supportsRegion(int dimension) {
            return dimension == 0 || dimension >= 2;
        }
    },

    /** Nested iterative Gauss–Legendre rules. */
    GAUSS_LEGENDRE(2) {
        @Override
        public CubatureIntegrator create(int batchSize, RandomGenerator random) {
            return new NestedGaussLegendreIntegrator();
        }
    },

    /** Batched plain Monte Carlo. */
    MONTE_CARLO(2) {
        @Override
        public CubatureIntegrator create(int batchSize, RandomGenerator random) {
            return new MonteCarloIntegrator(batchSize, random);
        }
    };

    private final int minimumDimension;

    QuadratureAlgorithm(int minimumDimension) {
        this.minimumDimension = minimumDimension;
    }

    /**
     * Creates an integrator.
     * @param batchSize Points per batch for batched algorithms (0 for the default)
     * @param random Random source for stochastic algorithms
     * @return Integrator
     */
    public abstract CubatureIntegrator create(int batchSize, RandomGenerator random);

    /**
     * Gets the smallest PDE domain dimension this algorithm accepts.
     * @return Minimum domain dimension
     */
    public int getMinimumDimension() {
        return minimumDimension;
    }

    /**
     * Checks whether a region of the given dimension can be integrated.
     * @param dimension Region dimension
     * @return true if supported
     */
    public boolean supportsRegion(int dimension) {
        return dimension >= 0;
    }
}
