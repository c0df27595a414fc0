/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when two variable names collide after normalization.
 */
public class DuplicateVariableException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public DuplicateVariableException(String message) {
        super(message, DiscretizationError.DUPLICATE_VARIABLE);
    }
}
