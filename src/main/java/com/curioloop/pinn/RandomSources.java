/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Default random sources for the sampling strategies.
 * <p>
 * Sampling is unseeded unless the system property {@value #SEED_PROPERTY} holds
 * a long, in which case every default generator starts from that seed. Hosts
 * that need per-discretization control pass their own generator to
 * {@link PhysicsInformedDiscretizer.Builder#random(RandomGenerator)}.
 * </p>
 */
public final class RandomSources {

    /** System property holding the default seed */
    public static final String SEED_PROPERTY = "pinn.random.seed";

    private RandomSources() {}

    /**
     * Creates the default generator.
     * @return Seeded generator if {@value #SEED_PROPERTY} is set, otherwise an unseeded one
     * @throws IllegalStateException if the property is not a valid long
     */
    public static RandomGenerator defaultGenerator() {
        String seed = System.getProperty(SEED_PROPERTY);
        if (seed == null || seed.trim().isEmpty()) {
            return new Well19937c();
        }
        try {
            return new Well19937c(Long.parseLong(seed.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + SEED_PROPERTY + ": " + seed, e);
        }
    }

    /**
     * Creates a generator with a fixed seed.
     * @param seed Seed
     * @return Seeded generator
     */
    public static RandomGenerator seeded(long seed) {
        return new Well19937c(seed);
    }
}
