/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when an expression applies a dependent variable or derivative outside the supported patterns.
 */
public class UnrecognizedExpressionPatternException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public UnrecognizedExpressionPatternException(String message) {
        super(message, DiscretizationError.UNRECOGNIZED_EXPRESSION_PATTERN);
    }
}
