/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

/**
 * Equation {@code lhs ~ rhs}; its residual {@code lhs - rhs} vanishes when the
 * equation is satisfied.
 */
public final class Equation {

    private final Expression lhs;
    private final Expression rhs;

    private Equation(Expression lhs, Expression rhs) {
        if (lhs == null || rhs == null) {
            throw new IllegalArgumentException("Both sides of an equation are required");
        }
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Creates an equation.
     * @param lhs Left-hand side
     * @param rhs Right-hand side
     * @return Equation
     */
    public static Equation of(Expression lhs, Expression rhs) {
        return new Equation(lhs, rhs);
    }

    /**
     * Creates an equation with a constant right-hand side.
     * @param lhs Left-hand side
     * @param rhs Constant right-hand side
     * @return Equation
     */
    public static Equation of(Expression lhs, double rhs) {
        return new Equation(lhs, new Literal(rhs));
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    /**
     * Gets the residual expression {@code lhs - rhs}.
     * @return Residual expression
     */
    public Expression residual() {
        return Expressions.subtract(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " ~ " + rhs;
    }
}
