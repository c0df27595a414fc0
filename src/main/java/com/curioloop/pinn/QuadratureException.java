/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when a quadrature solver fails to produce an integral estimate.
 */
public class QuadratureException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public QuadratureException(String message) {
        super(message, DiscretizationError.QUADRATURE_FAILURE);
    }

    public QuadratureException(String message, Throwable cause) {
        super(message, DiscretizationError.QUADRATURE_FAILURE, cause);
    }
}
