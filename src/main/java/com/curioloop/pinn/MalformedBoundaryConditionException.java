/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when a boundary condition is not a single equation applying a dependent variable.
 */
public class MalformedBoundaryConditionException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public MalformedBoundaryConditionException(String message) {
        super(message, DiscretizationError.MALFORMED_BOUNDARY_CONDITION);
    }
}
