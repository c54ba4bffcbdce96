/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariablePermutationTest {

    @Test
    public void threeBlocksKeepRelativeOrder() {
        final boolean[] bounded = {true, false, true, false, true};
        final boolean[] nonnegative = {true, true, false, false, true};
        final VariablePermutation p = VariablePermutation.compute(bounded, nonnegative);
        assertArrayEquals(new int[]{0, 4, 1, 2, 3}, p.permutation());
        assertArrayEquals(new int[]{0, 2, 3, 4, 1}, p.inverse());
        assertEquals(2, p.boundedEnd());
        assertEquals(3, p.nonnegativeEnd());
        assertFalse(p.isIdentity());
    }

    @Test
    public void applyAndInvert() {
        final VariablePermutation p = VariablePermutation.compute(new boolean[]{true, false, true, false, true},
                                                                  new boolean[]{true, true, false, false, true});
        final long[] v = {10, 11, 12, 13, 14};
        final long[] permuted = p.apply(v);
        assertArrayEquals(new long[]{10, 14, 11, 12, 13}, permuted);
        assertArrayEquals(v, p.applyInverse(permuted));
        assertArrayEquals(new Long[]{1L, 5L, null, null, null}, p.apply(new Long[]{1L, null, null, null, 5L}));
        assertArrayEquals(new boolean[]{true, true, true, false, false},
                          p.apply(new boolean[]{true, true, false, false, true}));
        final List<long[]> vectors = p.applyInverse(Collections.singletonList(permuted));
        assertArrayEquals(v, vectors.get(0));
    }

    @Test
    public void allBoundedIsIdentity() {
        final VariablePermutation p = VariablePermutation.compute(new boolean[]{true, true},
                                                                  new boolean[]{true, true});
        assertTrue(p.isIdentity());
        assertEquals(2, p.boundedEnd());
        assertEquals(2, p.nonnegativeEnd());
    }

    @Test
    public void identityChecksBlockEnds() {
        assertThrows(IllegalArgumentException.class, () -> VariablePermutation.identity(3, 2, 1));
        assertTrue(VariablePermutation.identity(3, 1, 2).isIdentity());
    }

    @Test
    public void lengthMismatch() {
        assertThrows(IllegalArgumentException.class,
                     () -> VariablePermutation.compute(new boolean[2], new boolean[3]));
    }
}
