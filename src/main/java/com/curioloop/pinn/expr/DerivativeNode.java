/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Canonical, directly evaluable form of a (possibly nested) derivative chain.
 * <p>
 * Perturbation vectors are stored in outer-to-inner application order: entry
 * {@code k} belongs to the {@code k}-th differentiation variable counted from
 * the outermost derivative. Each vector has the length of the argument list and
 * a single non-zero slot.
 * </p>
 */
public final class DerivativeNode extends Expression {

    private final String dependentVariable;
    private final int order;
    private final List<String> variables;
    private final double[][] perturbations;
    private final int trialIndex;
    private final List<Expression> arguments;
    private final int parameterSlot;

    public DerivativeNode(String dependentVariable, List<String> variables, double[][] perturbations,
                          int trialIndex, List<Expression> arguments, int parameterSlot) {
        if (variables.size() != perturbations.length) {
            throw new IllegalArgumentException("One perturbation vector is required per differentiation variable");
        }
        this.dependentVariable = dependentVariable;
        this.order = variables.size();
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.perturbations = new double[perturbations.length][];
        for (int i = 0; i < perturbations.length; i++) {
            this.perturbations[i] = perturbations[i].clone();
        }
        this.trialIndex = trialIndex;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.parameterSlot = parameterSlot;
    }

    public String getDependentVariable() {
        return dependentVariable;
    }

    public int getOrder() {
        return order;
    }

    /**
     * Gets the differentiation variables, outermost first.
     * @return Variable names
     */
    public List<String> getVariables() {
        return variables;
    }

    /**
     * Gets a copy of the perturbation vectors, outermost first.
     * @return Perturbation vectors
     */
    public double[][] getPerturbations() {
        double[][] copy = new double[perturbations.length][];
        for (int i = 0; i < perturbations.length; i++) {
            copy[i] = perturbations[i].clone();
        }
        return copy;
    }

    double[][] perturbations() {
        return perturbations;
    }

    public int getTrialIndex() {
        return trialIndex;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public int getParameterSlot() {
        return parameterSlot;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDerivative(this);
    }

    @Override
    public String toString() {
        StringBuilder eps = new StringBuilder();
        for (double[] p : perturbations) {
            if (eps.length() > 0) eps.append(", ");
            eps.append(Arrays.toString(p));
        }
        return "derivative(phi" + (trialIndex + 1) + ", " + Expressions.joinArguments(arguments)
                + ", [" + eps + "], " + order + ", θ" + (parameterSlot + 1) + ")";
    }
}
