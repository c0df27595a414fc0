/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Parametric function approximator standing in for an unknown PDE solution.
 * <p>
 * Implementations are supplied by the host (a neural network, a polynomial
 * ansatz, ...). The discretizer only evaluates them; it never inspects or
 * initializes their parameters.
 * </p>
 */
@FunctionalInterface
public interface TrialSolution {

    /**
     * Evaluates the approximator at one coordinate vector.
     * @param coordinates Coordinate vector (read-only)
     * @param parameters Parameter vector (read-only)
     * @return Output vector; component 0 is the trial value
     */
    double[] evaluate(double[] coordinates, double[] parameters);

    /**
     * Evaluates the approximator at a batch of coordinate vectors.
     * <p>
     * The default implementation evaluates each row in turn; vectorized
     * approximators may override it.
     * </p>
     * @param coordinates One coordinate vector per row
     * @param parameters Parameter vector (read-only)
     * @return One output vector per row
     */
    default double[][] evaluateBatch(double[][] coordinates, double[] parameters) {
        double[][] out = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            out[i] = evaluate(coordinates[i], parameters);
        }
        return out;
    }
}
