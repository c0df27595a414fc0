/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Closed domain interval {@code [lower, upper]} of an independent variable.
 */
public final class Interval {

    /** Relative slack for step counts and the final span point */
    static final double SPAN_TOLERANCE = 1e-9;

    private final double lower;
    private final double upper;

    /**
     * Creates an interval with the given limits.
     * @param lower Lower limit (finite)
     * @param upper Upper limit (finite, not below lower)
     */
    public Interval(double lower, double upper) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Interval limits must be finite");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("Lower limit must not exceed upper limit");
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates an interval with both limits.
     * @param lower Lower limit
     * @param upper Upper limit
     * @return Interval
     */
    public static Interval between(double lower, double upper) {
        return new Interval(lower, upper);
    }

    /**
     * Gets the lower limit.
     * @return Lower limit
     */
    public double getLower() {
        return lower;
    }

    /**
     * Gets the upper limit.
     * @return Upper limit
     */
    public double getUpper() {
        return upper;
    }

    /**
     * Checks if the interval holds a single value.
     * @return true if degenerate
     */
    public boolean isDegenerate() {
        return lower == upper;
    }

    /**
     * Discretizes the interval as {@code lower, lower + step, ...} up to and
     * including {@code upper} when it is reached.
     * <p>
     * Points are computed in decimal arithmetic so that, for example, a step of
     * 0.1 over [0, 1] yields exactly 11 points with 0.3 represented as the
     * nearest double to 0.3 rather than {@code 3 * 0.1}. A step count within
     * a relative {@value #SPAN_TOLERANCE} of an integer counts as that integer,
     * and a last point that close to {@code upper} is {@code upper} itself, so
     * steps such as 1/3 still end on the limit.
     * </p>
     * @param step Positive step
     * @return Span values in ascending order
     */
    public double[] span(double step) {
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("Step must be positive and finite");
        }
        BigDecimal lo = BigDecimal.valueOf(lower);
        BigDecimal dx = BigDecimal.valueOf(step);
        BigDecimal steps = BigDecimal.valueOf(upper).subtract(lo).divide(dx, MathContext.DECIMAL64);
        BigDecimal nearest = steps.setScale(0, RoundingMode.HALF_UP);
        BigDecimal slack = BigDecimal.valueOf(SPAN_TOLERANCE).multiply(nearest.max(BigDecimal.ONE));
        int count = (steps.subtract(nearest).abs().compareTo(slack) <= 0
                ? nearest : steps.setScale(0, RoundingMode.FLOOR)).intValueExact() + 1;
        double[] values = new double[count];
        for (int k = 0; k < count; k++) {
            values[k] = lo.add(dx.multiply(BigDecimal.valueOf(k))).doubleValue();
        }
        double last = values[count - 1];
        if (Math.abs(upper - last) <= SPAN_TOLERANCE * step) {
            values[count - 1] = upper;
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval other = (Interval) o;
        return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lower) + Double.hashCode(upper);
    }

    @Override
    public String toString() {
        if (isDegenerate()) return "[" + lower + "]";
        return "[" + lower + ", " + upper + "]";
    }
}
