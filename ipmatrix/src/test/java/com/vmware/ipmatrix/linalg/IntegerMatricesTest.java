/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IntegerMatricesTest {

    @Test
    public void rankOfDependentRows() {
        final long[][] a = {{1, 1}, {2, 2}, {0, 1}};
        assertEquals(2, IntegerMatrices.rank(a));
        assertArrayEquals(new int[]{0, 2}, IntegerMatrices.independentRows(a, 2));
    }

    @Test
    public void rankOfEmptyMatrix() {
        assertEquals(0, IntegerMatrices.rank(new long[0][], 3));
        assertArrayEquals(new int[0], IntegerMatrices.independentRows(new long[0][], 3));
    }

    @Test
    public void rankIgnoresScaling() {
        final long[][] a = {{6, 4, 2}, {3, 2, 1}, {0, 0, 5}};
        assertEquals(2, IntegerMatrices.rank(a));
    }

    @Test
    public void consistency() {
        final long[][] a = {{1, 1}, {2, 2}};
        assertTrue(IntegerMatrices.isConsistent(a, new long[]{1, 2}, 2));
        assertFalse(IntegerMatrices.isConsistent(a, new long[]{1, 3}, 2));
    }

    @Test
    public void multiplyAndTranspose() {
        final long[][] a = {{1, 2, 3}, {4, 5, 6}};
        assertArrayEquals(new long[]{14, 32}, IntegerMatrices.multiply(a, new long[]{1, 2, 3}));
        final long[][] t = IntegerMatrices.transpose(a, 3);
        assertEquals(3, t.length);
        assertArrayEquals(new long[]{3, 6}, t[2]);
    }

    @Test
    public void dotDetectsOverflow() {
        assertThrows(ArithmeticException.class,
                     () -> IntegerMatrices.dot(new long[]{Long.MAX_VALUE}, new long[]{2}));
    }

    @Test
    public void selection() {
        final long[][] a = {{1, 2, 3}, {4, 5, 6}};
        final long[][] cols = IntegerMatrices.selectColumns(a, new int[]{2, 0});
        assertArrayEquals(new long[]{3, 1}, cols[0]);
        assertArrayEquals(new long[]{6, 4}, cols[1]);
        assertArrayEquals(new long[]{4, 5, 6}, IntegerMatrices.selectRows(a, new int[]{1})[0]);
        assertArrayEquals(new long[]{3, 1}, IntegerMatrices.select(a[0], new int[]{2, 0}));
    }

    @Test
    public void masksAndComplements() {
        assertArrayEquals(new int[]{0, 2}, IntegerMatrices.indicesOf(new boolean[]{true, false, true}));
        assertArrayEquals(new int[]{1, 3}, IntegerMatrices.complement(new int[]{0, 2}, 4));
        assertTrue(IntegerMatrices.isZero(new long[3]));
        assertFalse(IntegerMatrices.isZero(new long[]{0, -1}));
    }

    @Test
    public void copyIsDeep() {
        final long[][] a = {{1, 2}};
        final long[][] copy = IntegerMatrices.copy(a);
        copy[0][0] = 7;
        assertEquals(1, a[0][0]);
        assertArrayEquals(new long[]{0, 1}, IntegerMatrices.identity(2)[1]);
    }
}
