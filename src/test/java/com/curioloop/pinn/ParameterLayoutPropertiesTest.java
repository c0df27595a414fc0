/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for splitting and joining flat parameter vectors.
 */
public class ParameterLayoutPropertiesTest {

    @Property(tries = 200)
    @Label("Split then concat reproduces the flat vector")
    void splitThenConcatIsIdentity(
            @ForAll @Size(min = 1, max = 6) List<@IntRange(min = 0, max = 8) Integer> lengths,
            @ForAll long seed
    ) {
        int[] sizes = lengths.stream().mapToInt(Integer::intValue).toArray();
        ParameterLayout layout = ParameterLayout.of(sizes);
        double[] flat = new Random(seed).doubles(layout.total()).toArray();

        double[][] blocks = layout.split(flat);

        assertThat(blocks).hasNumberOfRows(sizes.length);
        for (int i = 0; i < sizes.length; i++) {
            assertThat(blocks[i]).hasSize(sizes[i]);
        }
        assertThat(layout.concat(blocks)).containsExactly(flat);
    }

    @Property(tries = 100)
    @Label("Vectors of the wrong total length are rejected")
    void wrongLengthIsRejected(
            @ForAll @IntRange(min = 1, max = 10) int first,
            @ForAll @IntRange(min = 1, max = 10) int second,
            @ForAll @IntRange(min = 1, max = 3) int extra
    ) {
        ParameterLayout layout = ParameterLayout.of(first, second);

        assertThatThrownBy(() -> layout.split(new double[first + second + extra]))
                .isInstanceOf(ParameterLengthMismatchException.class);
    }

    @Example
    @Label("Offsets are prefix sums of the block lengths")
    void offsetsArePrefixSums() {
        ParameterLayout layout = ParameterLayout.of(3, 0, 2);

        assertThat(layout.offset(0)).isZero();
        assertThat(layout.offset(1)).isEqualTo(3);
        assertThat(layout.offset(2)).isEqualTo(3);
        assertThat(layout.total()).isEqualTo(5);
        assertThat(layout.split(new double[]{1, 2, 3, 4, 5})[2]).containsExactly(4, 5);
    }
}
