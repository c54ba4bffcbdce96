/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DoubleMatricesTest {

    @Test
    public void solveNeedsPivoting() {
        final double[] x = DoubleMatrices.solve(new double[][]{{0, 1}, {2, 1}}, new double[]{3, 5});
        assertArrayEquals(new double[]{1, 3}, x, 1e-9);
    }

    @Test
    public void singular() {
        assertThrows(IllegalStateException.class,
                     () -> DoubleMatrices.solve(new double[][]{{1, 2}, {2, 4}}, new double[]{1, 2}));
    }

    @Test
    public void notSquare() {
        assertThrows(IllegalArgumentException.class,
                     () -> DoubleMatrices.solve(new double[][]{{1, 2}}, new double[]{1, 2}));
    }
}
