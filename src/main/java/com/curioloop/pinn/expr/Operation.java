/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Application of an {@link Operator} to its arguments.
 */
public final class Operation extends Expression {

    private final Operator operator;
    private final List<Expression> arguments;

    public Operation(Operator operator, List<Expression> arguments) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator cannot be null");
        }
        if (arguments == null || !operator.accepts(arguments.size())) {
            throw new IllegalArgumentException(operator + " cannot take "
                    + (arguments == null ? 0 : arguments.size()) + " argument(s)");
        }
        this.operator = operator;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Operation)) return false;
        Operation other = (Operation) o;
        return operator == other.operator && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return 31 * operator.hashCode() + arguments.hashCode();
    }

    @Override
    public String toString() {
        return operator.render(arguments);
    }
}
