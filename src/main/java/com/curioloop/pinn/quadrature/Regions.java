/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

final class Regions {

    private Regions() {}

    static void checkBox(double[] lower, double[] upper) {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Integration bounds cannot be null");
        }
        if (lower.length != upper.length) {
            throw new IllegalArgumentException("Lower and upper bounds must have the same dimension");
        }
        for (int i = 0; i < lower.length; i++) {
            if (!Double.isFinite(lower[i]) || !Double.isFinite(upper[i])) {
                throw new IllegalArgumentException("Integration bounds must be finite on axis " + i);
            }
            if (lower[i] > upper[i]) {
                throw new IllegalArgumentException("Lower bound exceeds upper bound on axis " + i);
            }
        }
    }

    static double volume(double[] lower, double[] upper) {
        double v = 1;
        for (int i = 0; i < lower.length; i++) {
            v *= upper[i] - lower[i];
        }
        return v;
    }

    static boolean withinTolerance(double error, double value, double relTol, double absTol) {
        return error <= Math.max(absTol, relTol * Math.abs(value));
    }
}
