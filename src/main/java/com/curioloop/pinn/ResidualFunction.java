/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Residual of an equation or equation system at one collocation point.
 */
public interface ResidualFunction {

    /**
     * Evaluates the residuals.
     * @param coordinates Values of the free variables, in {@link #dimension()} order
     * @param parameters Flat parameter vector
     * @return One residual per equation
     */
    double[] evaluate(double[] coordinates, double[] parameters);

    /**
     * Gets the number of coordinates expected by {@link #evaluate}.
     * @return Free variable count
     */
    int dimension();

    /**
     * Sums the residual components.
     * @param coordinates Coordinate vector
     * @param parameters Flat parameter vector
     * @return {@code Σ_k R_k}
     */
    default double sum(double[] coordinates, double[] parameters) {
        double s = 0;
        for (double r : evaluate(coordinates, parameters)) {
            s += r;
        }
        return s;
    }

    /**
     * Sums the squared residual components.
     * @param coordinates Coordinate vector
     * @param parameters Flat parameter vector
     * @return {@code Σ_k R_k²}
     */
    default double sumOfSquares(double[] coordinates, double[] parameters) {
        double s = 0;
        for (double r : evaluate(coordinates, parameters)) {
            s += r * r;
        }
        return s;
    }
}
