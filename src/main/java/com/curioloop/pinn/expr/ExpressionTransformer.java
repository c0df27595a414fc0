/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.UnrecognizedExpressionPatternException;
import com.curioloop.pinn.VariableRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a symbolic expression tree into its canonical, directly evaluable form.
 * <p>
 * Two patterns are recognized, depth-first:
 * </p>
 * <ul>
 *   <li>{@code u(v1, ..., vD)} becomes an {@link EvaluateNode}</li>
 *   <li>{@code D_b(D_a(u(v1, ..., vD)))} becomes a single {@link DerivativeNode}
 *       of order 2 with perturbation vectors for {@code [b, a]}</li>
 * </ul>
 * <p>
 * Every other node is rebuilt with rewritten children. With a single dependent
 * variable all canonical nodes refer to trial solution 0 and parameter slot 0;
 * with several, dependent variable {@code i} (1-based) maps to slot {@code i - 1}.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ExpressionTransformer transformer = new ExpressionTransformer(
 *     VariableRegistry.of("x", "y"), VariableRegistry.of("u"));
 *
 * // Dx(Dx(u(x, y))) -> derivative(phi1, (x, y), [[h, 0], [h, 0]], 2, θ1)
 * Expression canonical = transformer.transform(derivative(apply("u", "x", "y"), "x", "x"));
 * }</pre>
 */
public final class ExpressionTransformer implements ExpressionVisitor<Expression> {

    private final VariableRegistry independent;
    private final VariableRegistry dependent;
    private final double step;

    /**
     * Creates a transformer using {@link NumericDerivative#STEP} for perturbations.
     * @param independent Independent variable registry
     * @param dependent Dependent variable registry
     */
    public ExpressionTransformer(VariableRegistry independent, VariableRegistry dependent) {
        this(independent, dependent, NumericDerivative.STEP);
    }

    /**
     * Creates a transformer with a custom perturbation magnitude.
     * @param independent Independent variable registry
     * @param dependent Dependent variable registry
     * @param step Perturbation magnitude placed in each perturbation vector
     */
    public ExpressionTransformer(VariableRegistry independent, VariableRegistry dependent, double step) {
        if (independent == null || dependent == null) {
            throw new IllegalArgumentException("Variable registries cannot be null");
        }
        if (dependent.size() == 0) {
            throw new IllegalArgumentException("At least one dependent variable is required");
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("Perturbation step must be positive");
        }
        this.independent = independent;
        this.dependent = dependent;
        this.step = step;
    }

    /**
     * Rewrites an expression tree.
     * @param expression Symbolic tree
     * @return Canonical tree
     * @throws UnrecognizedExpressionPatternException if a dependent variable or
     *         derivative is used outside the recognized patterns
     */
    public Expression transform(Expression expression) {
        return expression.accept(this);
    }

    /**
     * Rewrites an equation into its canonical residual {@code lhs' - rhs'}.
     * @param equation Equation
     * @return Canonical residual tree
     */
    public Expression transform(Equation equation) {
        return Expressions.subtract(transform(equation.getLhs()), transform(equation.getRhs()));
    }

    /**
     * Rewrites every equation of a set into canonical residual trees.
     * @param equations Equation set
     * @return Canonical residual trees in equation order
     */
    public List<Expression> transform(EquationSet equations) {
        List<Expression> residuals = new ArrayList<>(equations.size());
        for (Equation eq : equations.equations()) {
            residuals.add(transform(eq));
        }
        return residuals;
    }

    @Override
    public Expression visitLiteral(Literal literal) {
        return literal;
    }

    @Override
    public Expression visitVariable(VariableRef variable) {
        return variable;
    }

    @Override
    public Expression visitDependentApply(DependentApply apply) {
        int slot = slotOf(apply);
        return new EvaluateNode(apply.getName(), slot, apply.getArguments(), slot);
    }

    @Override
    public Expression visitDerivativeApply(DerivativeApply derivative) {
        List<String> variables = new ArrayList<>();
        Expression current = derivative;
        while (current instanceof DerivativeApply) {
            DerivativeApply d = (DerivativeApply) current;
            variables.add(d.getVariable());
            current = d.getOperand();
        }
        if (!(current instanceof DependentApply)) {
            throw new UnrecognizedExpressionPatternException(
                    "Derivative must be applied to a dependent variable application, got: " + current);
        }
        DependentApply apply = (DependentApply) current;
        int slot = slotOf(apply);
        int dim = apply.getArguments().size();

        double[][] perturbations = new double[variables.size()][];
        for (int k = 0; k < variables.size(); k++) {
            String v = variables.get(k);
            if (!independent.contains(v)) {
                throw new UnrecognizedExpressionPatternException(
                        "Cannot differentiate with respect to unknown variable '" + v + "' in " + derivative);
            }
            int axis = independent.indexOf(v) - 1;
            if (axis >= dim) {
                throw new UnrecognizedExpressionPatternException(
                        "Variable '" + v + "' has no argument position in " + apply);
            }
            double[] eps = new double[dim];
            eps[axis] = step;
            perturbations[k] = eps;
        }
        return new DerivativeNode(apply.getName(), variables, perturbations, slot, apply.getArguments(), slot);
    }

    @Override
    public Expression visitOperation(Operation operation) {
        List<Expression> args = new ArrayList<>(operation.getArguments().size());
        for (Expression arg : operation.getArguments()) {
            args.add(arg.accept(this));
        }
        return new Operation(operation.getOperator(), args);
    }

    @Override
    public Expression visitEvaluate(EvaluateNode node) {
        throw new UnrecognizedExpressionPatternException("Expression is already canonical: " + node);
    }

    @Override
    public Expression visitDerivative(DerivativeNode node) {
        throw new UnrecognizedExpressionPatternException("Expression is already canonical: " + node);
    }

    private int slotOf(DependentApply apply) {
        if (!dependent.contains(apply.getName())) {
            throw new UnrecognizedExpressionPatternException(
                    "Unknown dependent variable '" + apply.getName() + "' in " + apply);
        }
        for (Expression arg : apply.getArguments()) {
            if (arg instanceof VariableRef) {
                if (!independent.contains(((VariableRef) arg).getName())) {
                    throw new UnrecognizedExpressionPatternException(
                            "Unknown independent variable '" + arg + "' in " + apply);
                }
            } else if (!(arg instanceof Literal)) {
                throw new UnrecognizedExpressionPatternException(
                        "Arguments of " + apply.getName() + " must be variables or constants, got: " + arg);
            }
        }
        return dependent.size() == 1 ? 0 : dependent.indexOf(apply.getName()) - 1;
    }
}
