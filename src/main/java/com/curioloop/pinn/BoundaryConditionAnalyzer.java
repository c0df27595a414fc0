/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.DependentApply;
import com.curioloop.pinn.expr.DerivativeApply;
import com.curioloop.pinn.expr.DerivativeNode;
import com.curioloop.pinn.expr.EquationSet;
import com.curioloop.pinn.expr.EvaluateNode;
import com.curioloop.pinn.expr.Expression;
import com.curioloop.pinn.expr.ExpressionVisitor;
import com.curioloop.pinn.expr.Literal;
import com.curioloop.pinn.expr.Operation;
import com.curioloop.pinn.expr.VariableRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Determines, per boundary condition, which independent variables are fixed
 * by literal arguments and which remain free.
 * <p>
 * The arguments inspected are those of the first dependent-variable
 * application met depth-first in the left-hand side, looking through
 * derivatives: for {@code Dx(u(0, y)) ~ 0} they are {@code (0, y)}, so x is
 * fixed at 0 and y is free.
 * </p>
 */
public final class BoundaryConditionAnalyzer {

    private static final ExpressionVisitor<DependentApply> FIRST_APPLICATION = new FirstApplication();

    private final VariableRegistry independent;

    public BoundaryConditionAnalyzer(VariableRegistry independent) {
        this.independent = independent;
    }

    /**
     * Analyzes every boundary condition.
     * @param conditions Boundary conditions
     * @return Arguments per condition, in order
     */
    public List<BoundaryArguments> analyze(List<EquationSet> conditions) {
        List<BoundaryArguments> result = new ArrayList<>(conditions.size());
        for (EquationSet bc : conditions) {
            result.add(analyze(bc));
        }
        return result;
    }

    /**
     * Analyzes one boundary condition.
     * @param condition Boundary condition
     * @return Fixed and free arguments
     * @throws MalformedBoundaryConditionException if the condition is a system of
     *         equations or its left side applies no dependent variable
     */
    public BoundaryArguments analyze(EquationSet condition) {
        if (condition.isSystem()) {
            throw new MalformedBoundaryConditionException(
                    "Boundary condition must be a single equation, got a system: " + condition);
        }
        DependentApply apply = condition.get(0).getLhs().accept(FIRST_APPLICATION);
        if (apply == null) {
            throw new MalformedBoundaryConditionException(
                    "Boundary condition left-hand side applies no dependent variable: " + condition);
        }
        List<String> free = new ArrayList<>();
        Map<Integer, Double> fixed = new LinkedHashMap<>();
        List<Expression> args = apply.getArguments();
        for (int i = 0; i < args.size(); i++) {
            Expression arg = args.get(i);
            if (arg instanceof Literal) {
                fixed.put(i, ((Literal) arg).getValue());
            } else if (arg instanceof VariableRef) {
                String name = ((VariableRef) arg).getName();
                if (!independent.contains(name)) {
                    throw new UnrecognizedExpressionPatternException(
                            "Unknown independent variable '" + name + "' in boundary condition " + condition);
                }
                free.add(name);
            } else {
                throw new UnrecognizedExpressionPatternException(
                        "Boundary condition arguments must be variables or constants, got: " + arg);
            }
        }
        return new BoundaryArguments(condition, args, free, fixed);
    }

    private static final class FirstApplication implements ExpressionVisitor<DependentApply> {

        @Override
        public DependentApply visitLiteral(Literal literal) {
            return null;
        }

        @Override
        public DependentApply visitVariable(VariableRef variable) {
            return null;
        }

        @Override
        public DependentApply visitDependentApply(DependentApply apply) {
            return apply;
        }

        @Override
        public DependentApply visitDerivativeApply(DerivativeApply derivative) {
            return derivative.getOperand().accept(this);
        }

        @Override
        public DependentApply visitOperation(Operation operation) {
            for (Expression arg : operation.getArguments()) {
                DependentApply found = arg.accept(this);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }

        @Override
        public DependentApply visitEvaluate(EvaluateNode node) {
            return null;
        }

        @Override
        public DependentApply visitDerivative(DerivativeNode node) {
            return null;
        }
    }
}
