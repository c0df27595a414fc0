/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.TrialSolutionAdapter;
import com.curioloop.pinn.UnrecognizedExpressionPatternException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a canonical expression tree into a {@link CompiledExpression}.
 * <p>
 * Variable names are resolved to coordinate positions once, at compile time;
 * evaluation then only walks pre-built closures. Input trees must already have
 * been rewritten by {@link ExpressionTransformer}.
 * </p>
 */
public final class ExpressionCompiler implements ExpressionVisitor<CompiledExpression> {

    private final Map<String, Integer> coordinateSlots;
    private final List<TrialSolutionAdapter> trials;
    private final DerivativeOperator derivative;

    /**
     * Creates a compiler.
     * @param freeVariables Variables bound to coordinate positions 0, 1, ... in order
     * @param trials Trial solutions indexed by canonical trial index
     * @param derivative Derivative operator used for {@link DerivativeNode}s
     */
    public ExpressionCompiler(List<String> freeVariables, List<TrialSolutionAdapter> trials,
                              DerivativeOperator derivative) {
        Map<String, Integer> slots = new LinkedHashMap<>();
        for (int i = 0; i < freeVariables.size(); i++) {
            slots.put(freeVariables.get(i), i);
        }
        this.coordinateSlots = Collections.unmodifiableMap(slots);
        this.trials = trials;
        this.derivative = derivative;
    }

    public CompiledExpression compile(Expression canonical) {
        return canonical.accept(this);
    }

    @Override
    public CompiledExpression visitLiteral(Literal literal) {
        double value = literal.getValue();
        return (x, p) -> value;
    }

    @Override
    public CompiledExpression visitVariable(VariableRef variable) {
        Integer slot = coordinateSlots.get(variable.getName());
        if (slot == null) {
            throw new UnrecognizedExpressionPatternException(
                    "Variable '" + variable.getName() + "' is not bound to a coordinate; bound: "
                            + coordinateSlots.keySet());
        }
        int i = slot;
        return (x, p) -> x[i];
    }

    @Override
    public CompiledExpression visitDependentApply(DependentApply apply) {
        throw new UnrecognizedExpressionPatternException("Expression must be transformed before compilation: " + apply);
    }

    @Override
    public CompiledExpression visitDerivativeApply(DerivativeApply derivative) {
        throw new UnrecognizedExpressionPatternException("Expression must be transformed before compilation: " + derivative);
    }

    @Override
    public CompiledExpression visitOperation(Operation operation) {
        CompiledExpression[] args = compileAll(operation.getArguments());
        Operator operator = operation.getOperator();
        return (x, p) -> {
            double[] values = new double[args.length];
            for (int i = 0; i < args.length; i++) {
                values[i] = args[i].evaluate(x, p);
            }
            return operator.apply(values);
        };
    }

    @Override
    public CompiledExpression visitEvaluate(EvaluateNode node) {
        CompiledExpression[] args = compileAll(node.getArguments());
        TrialSolutionAdapter trial = trialAt(node.getTrialIndex());
        int slot = node.getParameterSlot();
        return (x, p) -> trial.value(point(args, x, p), p[slot]);
    }

    @Override
    public CompiledExpression visitDerivative(DerivativeNode node) {
        CompiledExpression[] args = compileAll(node.getArguments());
        TrialSolutionAdapter trial = trialAt(node.getTrialIndex());
        double[][] perturbations = node.perturbations();
        int order = node.getOrder();
        int slot = node.getParameterSlot();
        return (x, p) -> derivative.evaluate(trial, point(args, x, p), perturbations, order, p[slot]);
    }

    private CompiledExpression[] compileAll(List<Expression> expressions) {
        List<CompiledExpression> compiled = new ArrayList<>(expressions.size());
        for (Expression e : expressions) {
            compiled.add(e.accept(this));
        }
        return compiled.toArray(new CompiledExpression[0]);
    }

    private TrialSolutionAdapter trialAt(int index) {
        if (index < 0 || index >= trials.size()) {
            throw new UnrecognizedExpressionPatternException(
                    "No trial solution for index " + index + " (" + trials.size() + " available)");
        }
        return trials.get(index);
    }

    private static double[] point(CompiledExpression[] args, double[] x, double[][] p) {
        double[] point = new double[args.length];
        for (int i = 0; i < args.length; i++) {
            point[i] = args[i].evaluate(x, p);
        }
        return point;
    }
}
