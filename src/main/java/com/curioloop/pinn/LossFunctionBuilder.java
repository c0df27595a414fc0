/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.CompiledExpression;
import com.curioloop.pinn.expr.DerivativeOperator;
import com.curioloop.pinn.expr.EquationSet;
import com.curioloop.pinn.expr.Expression;
import com.curioloop.pinn.expr.ExpressionCompiler;
import com.curioloop.pinn.expr.ExpressionTransformer;
import com.curioloop.pinn.expr.NumericDerivative;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns equations into {@link ResidualFunction}s closed over the trial
 * solutions and the derivative operator.
 * <p>
 * For every equation the builder rewrites the tree with
 * {@link ExpressionTransformer}, binds the free variables to coordinate
 * positions in the order given, and compiles the result. At evaluation time the
 * flat parameter vector is split by the {@link ParameterLayout} and each trial
 * solution receives its own sub-vector.
 * </p>
 */
public final class LossFunctionBuilder {

    private final VariableRegistry independent;
    private final ExpressionTransformer transformer;
    private final List<TrialSolutionAdapter> trials;
    private final ParameterLayout layout;
    private final DerivativeOperator derivative;

    /**
     * Creates a builder.
     * @param independent Independent variable registry
     * @param dependent Dependent variable registry
     * @param trials One trial solution per dependent variable, in registry order
     * @param layout Parameter layout with one block per trial solution
     * @param derivative Derivative operator
     */
    public LossFunctionBuilder(VariableRegistry independent, VariableRegistry dependent,
                               List<TrialSolutionAdapter> trials, ParameterLayout layout,
                               DerivativeOperator derivative) {
        this(independent, dependent, trials, layout, derivative, NumericDerivative.STEP);
    }

    /**
     * Creates a builder with a custom perturbation magnitude.
     * @param independent Independent variable registry
     * @param dependent Dependent variable registry
     * @param trials One trial solution per dependent variable, in registry order
     * @param layout Parameter layout with one block per trial solution
     * @param derivative Derivative operator
     * @param step Magnitude placed in the perturbation vectors of derivative nodes
     */
    public LossFunctionBuilder(VariableRegistry independent, VariableRegistry dependent,
                               List<TrialSolutionAdapter> trials, ParameterLayout layout,
                               DerivativeOperator derivative, double step) {
        if (trials.size() != dependent.size()) {
            throw new IllegalArgumentException("Expected " + dependent.size()
                    + " trial solution(s), one per dependent variable, got " + trials.size());
        }
        if (layout.count() != trials.size()) {
            throw new ParameterLengthMismatchException("Parameter layout has " + layout.count()
                    + " block(s) for " + trials.size() + " trial solution(s)");
        }
        this.independent = independent;
        this.transformer = new ExpressionTransformer(independent, dependent, step);
        this.trials = Collections.unmodifiableList(new ArrayList<>(trials));
        this.layout = layout;
        this.derivative = derivative;
    }

    /**
     * Rewrites equations into canonical residual trees without compiling them.
     * @param equations Equations
     * @return Canonical residual trees
     */
    public List<Expression> canonicalize(EquationSet equations) {
        return transformer.transform(equations);
    }

    /**
     * Builds a residual function over all independent variables, in registry order.
     * @param equations Equations
     * @return Residual function
     */
    public ResidualFunction build(EquationSet equations) {
        return build(equations, independent.names());
    }

    /**
     * Builds a residual function over a subset of the independent variables.
     * @param equations Equations
     * @param freeVariables Variables bound to coordinate positions 0, 1, ... in order
     * @return Residual function
     * @throws com.curioloop.pinn.UnrecognizedExpressionPatternException if an equation
     *         uses an unsupported pattern or a variable outside {@code freeVariables}
     */
    public ResidualFunction build(EquationSet equations, List<String> freeVariables) {
        ExpressionCompiler compiler = new ExpressionCompiler(freeVariables, trials, derivative);
        List<Expression> canonical = canonicalize(equations);
        CompiledExpression[] components = new CompiledExpression[canonical.size()];
        for (int i = 0; i < components.length; i++) {
            components[i] = compiler.compile(canonical.get(i));
        }
        return new CompiledResidual(components, freeVariables.size(), layout);
    }

    public ParameterLayout getLayout() {
        return layout;
    }

    private static final class CompiledResidual implements ResidualFunction {

        private final CompiledExpression[] components;
        private final int dimension;
        private final ParameterLayout layout;

        CompiledResidual(CompiledExpression[] components, int dimension, ParameterLayout layout) {
            this.components = components;
            this.dimension = dimension;
            this.layout = layout;
        }

        @Override
        public double[] evaluate(double[] coordinates, double[] parameters) {
            double[][] blocks = layout.split(parameters);
            double[] residuals = new double[components.length];
            for (int i = 0; i < components.length; i++) {
                residuals[i] = components[i].evaluate(coordinates, blocks);
            }
            return residuals;
        }

        @Override
        public int dimension() {
            return dimension;
        }
    }
}
