/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Enumeration of discretization failure codes.
 */
public enum DiscretizationError {

    /** Two variables share a name after normalization */
    DUPLICATE_VARIABLE(1, "Duplicate variable name"),

    /** Boundary condition is not a single equation over a dependent variable */
    MALFORMED_BOUNDARY_CONDITION(2, "Malformed boundary condition"),

    /** Parameter sub-vector lengths do not match the flat parameter vector */
    PARAMETER_LENGTH_MISMATCH(3, "Parameter length mismatch"),

    /** Domain dimensionality too low for the requested strategy */
    DIMENSIONALITY(4, "Unsupported domain dimensionality"),

    /** Expression tree contains an unsupported dependent-variable or derivative pattern */
    UNRECOGNIZED_EXPRESSION_PATTERN(5, "Unrecognized expression pattern"),

    /** Quadrature solver could not produce an estimate */
    QUADRATURE_FAILURE(6, "Quadrature failure");

    private final int code;
    private final String message;

    DiscretizationError(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Gets the numeric error code.
     * @return Error code
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the error message.
     * @return Error message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Checks whether this error is raised while building the loss, before any
     * optimizer interaction.
     * @return true for compile-time errors
     */
    public boolean isCompileTime() {
        return this != QUADRATURE_FAILURE;
    }

    /**
     * Gets the error from a numeric code.
     * @param code Numeric error code
     * @return Corresponding error
     * @throws IllegalArgumentException if no error has this code
     */
    public static DiscretizationError fromCode(int code) {
        for (DiscretizationError error : values()) {
            if (error.code == code) {
                return error;
            }
        }
        throw new IllegalArgumentException("Unknown discretization error code: " + code);
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
