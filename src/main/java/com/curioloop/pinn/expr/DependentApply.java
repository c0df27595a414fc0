/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.VariableRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Application of a dependent variable to a tuple of arguments, such as
 * {@code u(x, y)} or, in a boundary condition, {@code u(0, y)}.
 * <p>
 * Arguments are expected to be {@link VariableRef} or {@link Literal} nodes;
 * anything else is rejected when the tree is transformed.
 * </p>
 */
public final class DependentApply extends Expression {

    private final String name;
    private final List<Expression> arguments;

    public DependentApply(String name, List<Expression> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("Dependent variable application needs at least one argument");
        }
        this.name = VariableRegistry.normalize(name);
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDependentApply(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DependentApply)) return false;
        DependentApply other = (DependentApply) o;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + arguments.hashCode();
    }

    @Override
    public String toString() {
        return name + Expressions.joinArguments(arguments);
    }
}
