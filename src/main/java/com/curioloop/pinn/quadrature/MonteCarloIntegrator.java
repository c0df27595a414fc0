/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Plain Monte Carlo integration in batches.
 * <p>
 * Each iteration draws one batch of uniform points and updates the running
 * mean and variance. The error estimate is the standard error
 * {@code volume * sqrt(variance / n)}.
 * </p>
 */
final class MonteCarloIntegrator implements CubatureIntegrator {

    static final int DEFAULT_BATCH = 1000;

    private final int batchSize;
    private final RandomGenerator random;

    /**
     * Creates an integrator.
     * @param batchSize Points per iteration (0 selects {@value #DEFAULT_BATCH})
     * @param random Random source
     */
    MonteCarloIntegrator(int batchSize, RandomGenerator random) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("Batch size must be non-negative");
        }
        if (random == null) {
            throw new IllegalArgumentException("Random generator cannot be null");
        }
        this.batchSize = batchSize == 0 ? DEFAULT_BATCH : Math.max(2, batchSize);
        this.random = random;
    }

    @Override
    public QuadratureResult integrate(Integrand integrand, double[] lower, double[] upper,
                                      double relTol, double absTol, int maxIterations) {
        Regions.checkBox(lower, upper);
        int dim = lower.length;
        if (dim == 0) {
            return QuadratureResult.point(integrand.evaluate(new double[0]));
        }
        double volume = Regions.volume(lower, upper);
        long n = 0;
        double mean = 0;
        double m2 = 0;
        double value = 0;
        double error = Double.POSITIVE_INFINITY;
        int iterations = 0;

        while (iterations < Math.max(1, maxIterations)) {
            double[][] batch = new double[batchSize][dim];
            for (double[] p : batch) {
                for (int i = 0; i < dim; i++) {
                    p[i] = lower[i] + (upper[i] - lower[i]) * random.nextDouble();
                }
            }
            for (double v : integrand.evaluateBatch(batch)) {
                n++;
                double delta = v - mean;
                mean += delta / n;
                m2 += delta * (v - mean);
            }
            iterations++;
            value = volume * mean;
            error = volume * Math.sqrt(m2 / (n - 1) / n);
            if (Double.isNaN(value) || Regions.withinTolerance(error, value, relTol, absTol)) {
                break;
            }
        }
        boolean converged = Regions.withinTolerance(error, value, relTol, absTol);
        return new QuadratureResult(value, error, iterations, (int) Math.min(n, Integer.MAX_VALUE), converged);
    }
}
