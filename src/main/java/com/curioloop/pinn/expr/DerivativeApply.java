/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.VariableRegistry;

/**
 * First-order partial derivative of an operand with respect to one independent
 * variable. Higher-order and mixed partials nest these nodes.
 */
public final class DerivativeApply extends Expression {

    private final Expression operand;
    private final String variable;

    public DerivativeApply(Expression operand, String variable) {
        if (operand == null) {
            throw new IllegalArgumentException("Derivative operand cannot be null");
        }
        this.operand = operand;
        this.variable = VariableRegistry.normalize(variable);
    }

    public Expression getOperand() {
        return operand;
    }

    public String getVariable() {
        return variable;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDerivativeApply(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DerivativeApply)) return false;
        DerivativeApply other = (DerivativeApply) o;
        return variable.equals(other.variable) && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return 31 * operand.hashCode() + variable.hashCode();
    }

    @Override
    public String toString() {
        return "D" + variable + "(" + operand + ")";
    }
}
