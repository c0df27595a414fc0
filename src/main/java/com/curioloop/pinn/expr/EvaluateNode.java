/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical evaluation of a trial solution at the point given by its argument
 * expressions, using the parameter sub-vector in {@code parameterSlot}.
 */
public final class EvaluateNode extends Expression {

    private final String dependentVariable;
    private final int trialIndex;
    private final List<Expression> arguments;
    private final int parameterSlot;

    public EvaluateNode(String dependentVariable, int trialIndex, List<Expression> arguments, int parameterSlot) {
        this.dependentVariable = dependentVariable;
        this.trialIndex = trialIndex;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.parameterSlot = parameterSlot;
    }

    public String getDependentVariable() {
        return dependentVariable;
    }

    /**
     * Gets the 0-based index of the trial solution to evaluate.
     * @return Trial-solution index
     */
    public int getTrialIndex() {
        return trialIndex;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    /**
     * Gets the 0-based index of the parameter sub-vector bound to the trial solution.
     * @return Parameter slot
     */
    public int getParameterSlot() {
        return parameterSlot;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitEvaluate(this);
    }

    @Override
    public String toString() {
        return "phi" + (trialIndex + 1) + Expressions.joinArguments(arguments) + "[θ" + (parameterSlot + 1) + "]";
    }
}
