/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

/**
 * Immutable node of a symbolic expression tree.
 * <p>
 * Trees are built with the factory methods in {@link Expressions} or the fluent
 * arithmetic helpers below, and traversed with an {@link ExpressionVisitor}.
 * </p>
 */
public abstract class Expression {

    Expression() {}

    /**
     * Dispatches to the visitor method for this node kind.
     * @param visitor Visitor
     * @param <R> Result type
     * @return Visitor result
     */
    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    public Expression plus(Expression other) {
        return Expressions.add(this, other);
    }

    public Expression plus(double value) {
        return Expressions.add(this, Expressions.constant(value));
    }

    public Expression minus(Expression other) {
        return Expressions.subtract(this, other);
    }

    public Expression minus(double value) {
        return Expressions.subtract(this, Expressions.constant(value));
    }

    public Expression times(Expression other) {
        return Expressions.multiply(this, other);
    }

    public Expression times(double value) {
        return Expressions.multiply(Expressions.constant(value), this);
    }

    public Expression dividedBy(Expression other) {
        return Expressions.divide(this, other);
    }

    public Expression negate() {
        return Expressions.negate(this);
    }

    public Expression pow(double exponent) {
        return Expressions.pow(this, Expressions.constant(exponent));
    }
}
