/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

/**
 * Scalar function integrated over a box.
 */
@FunctionalInterface
public interface Integrand {

    /**
     * Evaluates the integrand at one point.
     * @param point Coordinates (read-only)
     * @return Integrand value
     */
    double evaluate(double[] point);

    /**
     * Evaluates the integrand at several points.
     * @param points One point per row
     * @return Value per row
     */
    default double[] evaluateBatch(double[][] points) {
        double[] values = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            values[i] = evaluate(points[i]);
        }
        return values;
    }
}
