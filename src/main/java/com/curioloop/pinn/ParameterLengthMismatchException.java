/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when per-trial-solution parameter lengths do not add up to the flat parameter vector.
 */
public class ParameterLengthMismatchException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public ParameterLengthMismatchException(String message) {
        super(message, DiscretizationError.PARAMETER_LENGTH_MISMATCH);
    }
}
