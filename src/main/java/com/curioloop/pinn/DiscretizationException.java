/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Base exception for failures while compiling a PDE system into a loss function.
 * <p>
 * Every subclass carries the {@link DiscretizationError} that classifies it.
 * </p>
 */
public class DiscretizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DiscretizationError error;

    /**
     * Creates a discretization exception.
     * @param message Error message
     * @param error Error classification
     */
    public DiscretizationException(String message, DiscretizationError error) {
        super(message);
        this.error = error;
    }

    /**
     * Creates a discretization exception with cause.
     * @param message Error message
     * @param error Error classification
     * @param cause Underlying cause
     */
    public DiscretizationException(String message, DiscretizationError error, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /**
     * Gets the error classification.
     * @return Error
     */
    public DiscretizationError getError() {
        return error;
    }
}
