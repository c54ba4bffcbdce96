/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import com.google.common.base.Preconditions;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Static helpers over integer matrices. All arithmetic is exact: products and sums overflow into an
 * ArithmeticException rather than wrapping around.
 */
public final class IntegerMatrices {

    private IntegerMatrices() {
    }

    public static int rank(final long[][] a, final int columns) {
        final EchelonBasis basis = new EchelonBasis(columns);
        for (final long[] row : a) {
            basis.add(row);
        }
        return basis.rank();
    }

    public static int rank(final long[][] a) {
        if (a.length == 0) {
            return 0;
        }
        return rank(a, a[0].length);
    }

    /**
     * Greedily selects a maximal set of linearly independent rows, scanning rows in order.
     *
     * @return indices of the selected rows, in increasing order
     */
    public static int[] independentRows(final long[][] a, final int columns) {
        final EchelonBasis basis = new EchelonBasis(columns);
        final int[] selected = new int[a.length];
        int count = 0;
        for (int i = 0; i < a.length; i++) {
            if (basis.add(a[i])) {
                selected[count++] = i;
            }
        }
        return Arrays.copyOf(selected, count);
    }

    /**
     * Returns true iff Ax = b has a rational solution, i.e. rank(A) == rank([A | b]).
     */
    public static boolean isConsistent(final long[][] a, final long[] b, final int columns) {
        Preconditions.checkArgument(a.length == b.length, "Row count mismatch: %s vs %s", a.length, b.length);
        final long[][] augmented = new long[a.length][];
        for (int i = 0; i < a.length; i++) {
            augmented[i] = Arrays.copyOf(a[i], columns + 1);
            augmented[i][columns] = b[i];
        }
        return rank(a, columns) == rank(augmented, columns + 1);
    }

    public static long[] multiply(final long[][] a, final long[] x) {
        final long[] result = new long[a.length];
        for (int i = 0; i < a.length; i++) {
            Preconditions.checkArgument(a[i].length == x.length, "Dimension mismatch: %s vs %s",
                                        a[i].length, x.length);
            result[i] = dot(a[i], x);
        }
        return result;
    }

    public static long dot(final long[] u, final long[] v) {
        long sum = 0;
        for (int j = 0; j < u.length; j++) {
            sum = Math.addExact(sum, Math.multiplyExact(u[j], v[j]));
        }
        return sum;
    }

    public static long[][] transpose(final long[][] a, final int columns) {
        final long[][] t = new long[columns][a.length];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < columns; j++) {
                t[j][i] = a[i][j];
            }
        }
        return t;
    }

    public static long[][] selectColumns(final long[][] a, final int[] columns) {
        final long[][] out = new long[a.length][columns.length];
        for (int i = 0; i < a.length; i++) {
            for (int k = 0; k < columns.length; k++) {
                out[i][k] = a[i][columns[k]];
            }
        }
        return out;
    }

    public static long[][] selectRows(final long[][] a, final int[] rows) {
        final long[][] out = new long[rows.length][];
        for (int k = 0; k < rows.length; k++) {
            out[k] = a[rows[k]].clone();
        }
        return out;
    }

    public static long[] select(final long[] v, final int[] indices) {
        final long[] out = new long[indices.length];
        for (int k = 0; k < indices.length; k++) {
            out[k] = v[indices[k]];
        }
        return out;
    }

    public static boolean isZero(final long[] v) {
        for (final long x : v) {
            if (x != 0) {
                return false;
            }
        }
        return true;
    }

    public static long[][] copy(final long[][] a) {
        final long[][] out = new long[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i].clone();
        }
        return out;
    }

    public static long[][] identity(final int n) {
        final long[][] id = new long[n][n];
        for (int i = 0; i < n; i++) {
            id[i][i] = 1;
        }
        return id;
    }

    /**
     * Indices at which mask is true, in increasing order.
     */
    public static int[] indicesOf(final boolean[] mask) {
        int count = 0;
        for (final boolean b : mask) {
            if (b) {
                count++;
            }
        }
        final int[] out = new int[count];
        int k = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                out[k++] = i;
            }
        }
        return out;
    }

    /**
     * Indices in [0, n) that do not appear in indices, in increasing order.
     */
    public static int[] complement(final int[] indices, final int n) {
        final boolean[] excluded = new boolean[n];
        for (final int i : indices) {
            Preconditions.checkArgument(i >= 0 && i < n, "Index %s out of range [0, %s)", i, n);
            excluded[i] = true;
        }
        final boolean[] kept = new boolean[n];
        for (int i = 0; i < n; i++) {
            kept[i] = !excluded[i];
        }
        return indicesOf(kept);
    }

    static BigInteger[][] toBig(final long[][] a, final int columns) {
        final BigInteger[][] out = new BigInteger[a.length][columns];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < columns; j++) {
                out[i][j] = BigInteger.valueOf(a[i][j]);
            }
        }
        return out;
    }

    static long[][] toLong(final BigInteger[][] a) {
        final long[][] out = new long[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new long[a[i].length];
            for (int j = 0; j < a[i].length; j++) {
                out[i][j] = a[i][j].longValueExact();
            }
        }
        return out;
    }
}
