/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

/**
 * Result of a numerical integration.
 */
public final class QuadratureResult {

    private final double value;
    private final double error;
    private final int iterations;
    private final int evaluations;
    private final boolean converged;

    /**
     * Creates an integration result.
     * @param value Integral estimate
     * @param error Error estimate
     * @param iterations Number of refinement steps
     * @param evaluations Number of integrand evaluations
     * @param converged Whether the tolerance was met
     */
    public QuadratureResult(double value, double error, int iterations, int evaluations, boolean converged) {
        this.value = value;
        this.error = error;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.converged = converged;
    }

    /**
     * Creates the result of integrating over a single point.
     * @param value Integrand value at the point
     * @return Exact result
     */
    static QuadratureResult point(double value) {
        return new QuadratureResult(value, 0.0, 0, 1, true);
    }

    /**
     * Gets the integral estimate.
     * @return Integral value
     */
    public double getValue() {
        return value;
    }

    /**
     * Gets the estimated absolute error.
     * @return Error estimate
     */
    public double getError() {
        return error;
    }

    /**
     * Gets the number of refinement steps.
     * @return Iteration count
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Gets the number of integrand evaluations.
     * @return Evaluation count
     */
    public int getEvaluations() {
        return evaluations;
    }

    /**
     * Checks if the requested tolerance was met.
     * @return true if converged
     */
    public boolean isConverged() {
        return converged;
    }

    @Override
    public String toString() {
        return "QuadratureResult{" +
                "value=" + value +
                ", error=" + error +
                ", iterations=" + iterations +
                ", evaluations=" + evaluations +
                ", converged=" + converged +
                '}';
    }
}
