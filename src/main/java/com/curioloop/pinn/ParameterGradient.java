/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Finite-difference gradients of a loss with respect to its parameters.
 * <p>
 * This is distinct from the coordinate derivatives used inside residuals:
 * here each parameter is perturbed in turn, relative to its magnitude.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Central difference, O(h²)
 * Evaluation accurate = ParameterGradient.CENTRAL.wrap(problem.getObjective());
 *
 * // Forward difference, O(h), one extra loss evaluation per parameter
 * Evaluation fast = ParameterGradient.FORWARD.wrap(problem.getObjective());
 * }</pre>
 *
 * @see Evaluation
 */
public enum ParameterGradient {

    /**
     * Forward difference, one extra evaluation per parameter.
     * <p>
     * g[i] ≈ (L(θ + h*e_i) - L(θ)) / h
     * </p>
     */
    FORWARD(Math.sqrt(Math.ulp(1.0))) {
        @Override
        double slope(LossFunction loss, double[] theta, int i, double h, double value) {
            double ti = theta[i];
            // step away from zero, rounded to what θ + h can represent
            double shift = ti < 0 ? -h : h;
            shift = (ti + shift) - ti;
            theta[i] = ti + shift;
            double moved = loss.evaluate(theta);
            theta[i] = ti;
            return (moved - value) / shift;
        }
    },

    /**
     * Central difference, two extra evaluations per parameter.
     * <p>
     * g[i] ≈ (L(θ + h*e_i) - L(θ - h*e_i)) / (2*h)
     * </p>
     */
    CENTRAL(Math.cbrt(Math.ulp(1.0))) {
        @Override
        double slope(LossFunction loss, double[] theta, int i, double h, double value) {
            double ti = theta[i];
            theta[i] = ti + h;
            double ahead = loss.evaluate(theta);
            theta[i] = ti - h;
            double behind = loss.evaluate(theta);
            theta[i] = ti;
            return (ahead - behind) / (2.0 * h);
        }
    };

    /** Relative step scale */
    private final double scale;

    ParameterGradient(double scale) {
        this.scale = scale;
    }

    /**
     * Wraps a loss into an objective callback with a numerical gradient.
     * <p>
     * The caller's parameter array is never modified.
     * </p>
     * @param loss Loss over the flat parameter vector
     * @return Evaluation computing the loss and, on request, its gradient
     */
    public Evaluation wrap(LossFunction loss) {
        if (loss == null) {
            throw new IllegalArgumentException("Loss cannot be null");
        }
        return (parameters, gradient) -> {
            double value = loss.evaluate(parameters);
            if (gradient != null) {
                if (gradient.length != parameters.length) {
                    throw new ParameterLengthMismatchException("Gradient length " + gradient.length
                            + " does not match parameter length " + parameters.length);
                }
                gradient(loss, parameters.clone(), value, gradient);
            }
            return value;
        };
    }

    /**
     * Differentiates the loss along every parameter in turn.
     * @param loss Loss
     * @param theta Working copy of the parameters, restored after each step
     * @param value Loss at {@code theta}
     * @param g Output gradient
     */
    void gradient(LossFunction loss, double[] theta, double value, double[] g) {
        for (int i = 0; i < theta.length; i++) {
            g[i] = slope(loss, theta, i, scale * Math.max(1.0, Math.abs(theta[i])), value);
        }
    }

    abstract double slope(LossFunction loss, double[] theta, int i, double h, double value);
}
