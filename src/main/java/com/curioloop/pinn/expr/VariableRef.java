/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.VariableRegistry;

/**
 * Reference to an independent variable by name.
 */
public final class VariableRef extends Expression {

    private final String name;

    public VariableRef(String name) {
        this.name = VariableRegistry.normalize(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableRef && ((VariableRef) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
