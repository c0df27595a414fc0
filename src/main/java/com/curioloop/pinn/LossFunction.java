/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Scalar loss over a flat parameter vector.
 * <p>
 * Losses are non-negative and vanish when every residual vanishes at every
 * evaluated point.
 * </p>
 */
@FunctionalInterface
public interface LossFunction {

    /**
     * Evaluates the loss.
     * @param parameters Flat parameter vector (read-only)
     * @return Loss value
     */
    double evaluate(double[] parameters);

    /**
     * Adds another loss, evaluating this one first.
     * @param other Loss evaluated second
     * @return Sum of both losses
     */
    default LossFunction plus(LossFunction other) {
        return parameters -> {
            double first = evaluate(parameters);
            return first + other.evaluate(parameters);
        };
    }
}
