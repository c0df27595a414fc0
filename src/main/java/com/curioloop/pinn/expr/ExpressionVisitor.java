/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

/**
 * Visitor over every {@link Expression} node kind.
 * <p>
 * The first five methods cover the symbolic input tree; the last two cover the
 * canonical nodes produced by {@link ExpressionTransformer}.
 * </p>
 *
 * @param <R> Result type
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal literal);

    R visitVariable(VariableRef variable);

    R visitDependentApply(DependentApply apply);

    R visitDerivativeApply(DerivativeApply derivative);

    R visitOperation(Operation operation);

    R visitEvaluate(EvaluateNode node);

    R visitDerivative(DerivativeNode node);
}
