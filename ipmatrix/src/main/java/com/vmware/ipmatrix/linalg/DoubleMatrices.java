/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import com.google.common.base.Preconditions;

/**
 * Floating point helpers, used only where the data is already real valued (objective rows).
 */
public final class DoubleMatrices {
    private static final double SINGULARITY_THRESHOLD = 1e-12;

    private DoubleMatrices() {
    }

    /**
     * Solves the square system M x = rhs with Gaussian elimination and partial pivoting.
     *
     * @throws IllegalStateException if M is (numerically) singular
     */
    public static double[] solve(final double[][] m, final double[] rhs) {
        final int n = rhs.length;
        Preconditions.checkArgument(m.length == n, "Expected a square system of size %s", n);
        final double[][] a = new double[n][];
        final double[] x = rhs.clone();
        for (int i = 0; i < n; i++) {
            Preconditions.checkArgument(m[i].length == n, "Expected a square system of size %s", n);
            a[i] = m[i].clone();
        }
        for (int col = 0; col < n; col++) {
            int best = col;
            for (int i = col + 1; i < n; i++) {
                if (Math.abs(a[i][col]) > Math.abs(a[best][col])) {
                    best = i;
                }
            }
            Preconditions.checkState(Math.abs(a[best][col]) > SINGULARITY_THRESHOLD,
                                     "Singular matrix: no pivot in column %s", col);
            final double[] rowTmp = a[col];
            a[col] = a[best];
            a[best] = rowTmp;
            final double rhsTmp = x[col];
            x[col] = x[best];
            x[best] = rhsTmp;
            for (int i = col + 1; i < n; i++) {
                final double factor = a[i][col] / a[col][col];
                if (factor == 0.0) {
                    continue;
                }
                for (int j = col; j < n; j++) {
                    a[i][j] -= factor * a[col][j];
                }
                x[i] -= factor * x[col];
            }
        }
        for (int i = n - 1; i >= 0; i--) {
            double sum = x[i];
            for (int j = i + 1; j < n; j++) {
                sum -= a[i][j] * x[j];
            }
            x[i] = sum / a[i][i];
        }
        return x;
    }
}
