/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Thrown when a strategy is requested on a domain with too few independent variables.
 */
public class DimensionalityException extends DiscretizationException {

    private static final long serialVersionUID = 1L;

    public DimensionalityException(String message) {
        super(message, DiscretizationError.DIMENSIONALITY);
    }
}
