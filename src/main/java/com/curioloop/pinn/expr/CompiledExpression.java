/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

/**
 * Canonical expression compiled into nested closures.
 */
@FunctionalInterface
public interface CompiledExpression {

    /**
     * Evaluates the expression.
     * @param coordinates Coordinate vector bound to the expression's free variables
     * @param parameters Parameter sub-vector per trial solution
     * @return Value
     */
    double evaluate(double[] coordinates, double[][] parameters);
}
