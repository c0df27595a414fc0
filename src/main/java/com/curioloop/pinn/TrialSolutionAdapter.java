/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Uniform view of a {@link TrialSolution} as {@code (coordinates, parameters) -> outputs}
 * with a scalar accessor for the trial value.
 */
public final class TrialSolutionAdapter {

    private final TrialSolution solution;

    public TrialSolutionAdapter(TrialSolution solution) {
        if (solution == null) {
            throw new IllegalArgumentException("Trial solution cannot be null");
        }
        this.solution = solution;
    }

    /**
     * Evaluates the full output vector.
     * @param coordinates Coordinate vector
     * @param parameters Parameter vector
     * @return Output vector
     */
    public double[] outputs(double[] coordinates, double[] parameters) {
        return solution.evaluate(coordinates, parameters);
    }

    /**
     * Evaluates the full output vectors of a coordinate batch.
     * @param coordinates One coordinate vector per row
     * @param parameters Parameter vector
     * @return One output vector per row
     */
    public double[][] outputs(double[][] coordinates, double[] parameters) {
        return solution.evaluateBatch(coordinates, parameters);
    }

    /**
     * Evaluates the scalar trial value (output component 0).
     * @param coordinates Coordinate vector
     * @param parameters Parameter vector
     * @return Trial value
     */
    public double value(double[] coordinates, double[] parameters) {
        return first(solution.evaluate(coordinates, parameters));
    }

    /**
     * Evaluates the scalar trial value for each row of a coordinate batch.
     * @param coordinates One coordinate vector per row
     * @param parameters Parameter vector
     * @return Trial value per row
     */
    public double[] values(double[][] coordinates, double[] parameters) {
        double[][] out = solution.evaluateBatch(coordinates, parameters);
        double[] values = new double[out.length];
        for (int i = 0; i < out.length; i++) {
            values[i] = first(out[i]);
        }
        return values;
    }

    private static double first(double[] out) {
        if (out == null || out.length == 0) {
            throw new IllegalStateException("Trial solution returned no output");
        }
        return out[0];
    }
}
