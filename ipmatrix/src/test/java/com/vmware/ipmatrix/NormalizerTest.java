/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NormalizerTest {

    private static ProblemData boundedData() {
        return new ProblemData(new long[][]{{1, 2}}, new long[]{4}, new double[][]{{3, 5}},
                               new Long[]{2L, null}, new boolean[]{true, false});
    }

    @Test
    public void standardFormAddsSlacksAndBoundRows() {
        final ProblemData normalized = Normalizer.normalize(boundedData(), true, true);
        assertEquals(2, normalized.m());
        assertEquals(4, normalized.n());
        final long[][] a = normalized.a();
        assertArrayEquals(new long[]{1, 2, 1, 0}, a[0]);
        assertArrayEquals(new long[]{1, 0, 0, 1}, a[1]);
        assertArrayEquals(new long[]{4, 2}, normalized.b());
        assertArrayEquals(new double[]{-3, -5, 0, 0}, normalized.objective(), 1e-12);
        assertArrayEquals(new boolean[]{true, false, true, true}, normalized.nonnegative());
        final Long[] u = normalized.u();
        assertEquals(2L, u[0]);
        assertNull(u[1]);
        assertNull(u[2]);
        assertNull(u[3]);
    }

    @Test
    public void objectiveKeptWithoutInversion() {
        final ProblemData normalized = Normalizer.normalize(boundedData(), true, false);
        assertArrayEquals(new double[]{3, 5, 0, 0}, normalized.objective(), 1e-12);
    }

    @Test
    public void disabledNormalizationKeepsData() {
        final ProblemData data = boundedData();
        assertEquals(data, Normalizer.normalize(data, false, true));
    }

    @Test
    public void dependentRowsAreDropped() {
        final ProblemData data = ProblemData.allNonnegative(new long[][]{{1, 1}, {2, 2}}, new long[]{1, 2},
                                                            new double[][]{{0, 0}}, new Long[2]);
        final ProblemData independent = Normalizer.normalize(data, false, false);
        assertEquals(1, independent.m());
        assertArrayEquals(new long[]{1, 1}, independent.a()[0]);
        assertArrayEquals(new long[]{1}, independent.b());
    }

    @Test
    public void contradictingRows() {
        final ProblemData data = ProblemData.allNonnegative(new long[][]{{1, 1}, {2, 2}}, new long[]{1, 3},
                                                            new double[][]{{0, 0}}, new Long[2]);
        assertThrows(InfeasibleRelaxationException.class, () -> Normalizer.normalize(data, true, true));
    }

    @Test
    public void dimensionsAreChecked() {
        assertThrows(IllegalArgumentException.class,
                     () -> ProblemData.allNonnegative(new long[][]{{1, 1}}, new long[]{1, 2},
                                                      new double[][]{{0, 0}}, new Long[2]));
        assertThrows(IllegalArgumentException.class,
                     () -> ProblemData.allNonnegative(new long[][]{{1, 1}}, new long[]{1},
                                                      new double[][]{{0}}, new Long[2]));
    }
}
