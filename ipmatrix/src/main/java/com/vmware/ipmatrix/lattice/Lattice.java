/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.lattice;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.InfeasibleRelaxationException;
import com.vmware.ipmatrix.linalg.HermiteNormalForm;
import com.vmware.ipmatrix.linalg.IntegerMatrices;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * The integer lattice ker(A) of an m x n integer matrix A, together with the unimodular transform needed to
 * solve A x = b over the integers.
 *
 * Both are read off the upper row HNF of the n x (m + n) matrix [A^t | I]: if H = U [A^t | I] then the left
 * block of H is U A^t, its first r rows hold the pivots (r = rank(A)) and the remaining rows of U span
 * ker(A). Everything is computed over BigInteger and only converted to long at the boundary.
 */
public final class Lattice {
    private final long[][] a;
    private final int m;
    private final int n;
    private final HermiteNormalForm hnf;
    private final int rank;

    private Lattice(final long[][] a, final int n, final HermiteNormalForm hnf) {
        this.a = a;
        this.m = a.length;
        this.n = n;
        this.hnf = hnf;
        this.rank = hnf.rankOfLeadingColumns(a.length);
    }

    /**
     * @param a the constraint matrix, with m rows of length n
     * @param n number of columns of a, needed when a has no rows
     */
    public static Lattice of(final long[][] a, final int n) {
        final int m = a.length;
        final long[][] augmented = new long[n][m + n];
        for (int i = 0; i < m; i++) {
            Preconditions.checkArgument(a[i].length == n, "Row %s has length %s, expected %s", i, a[i].length, n);
            for (int j = 0; j < n; j++) {
                augmented[j][i] = a[i][j];
            }
        }
        for (int j = 0; j < n; j++) {
            augmented[j][m + j] = 1;
        }
        return new Lattice(IntegerMatrices.copy(a), n, HermiteNormalForm.of(augmented, m + n));
    }

    public int rank() {
        return rank;
    }

    public int dimension() {
        return n - rank;
    }

    /**
     * A row basis of ker(A): n - rank rows of length n.
     *
     * @throws ArithmeticException if an entry does not fit in a long
     */
    public long[][] basis() {
        return hnf.block(rank, n, m, m + n);
    }

    /**
     * Finds an integer x with A x = b.
     *
     * @return the solution, or empty if A x = b has no integer solution
     */
    public Optional<long[]> solve(final long[] b) {
        Preconditions.checkArgument(b.length == m, "Expected a right-hand side of length %s, got %s", m, b.length);
        // A x = b with x = U^t y becomes (U A^t)^t y = b, a triangular system in the first rank entries of y.
        final BigInteger[] y = new BigInteger[rank];
        for (int k = 0; k < rank; k++) {
            final int p = hnf.pivotColumn(k);
            BigInteger residual = BigInteger.valueOf(b[p]);
            for (int l = 0; l < k; l++) {
                residual = residual.subtract(y[l].multiply(hnf.entry(l, p)));
            }
            final BigInteger[] qr = residual.divideAndRemainder(hnf.entry(k, p));
            if (qr[1].signum() != 0) {
                return Optional.empty();
            }
            y[k] = qr[0];
        }
        final long[] x = new long[n];
        for (int j = 0; j < n; j++) {
            BigInteger sum = BigInteger.ZERO;
            for (int k = 0; k < rank; k++) {
                sum = sum.add(y[k].multiply(hnf.entry(k, m + j)));
            }
            x[j] = sum.longValueExact();
        }
        // Columns without a pivot were not used above; they hold iff the system is consistent.
        if (!Arrays.equals(IntegerMatrices.multiply(a, x), b)) {
            return Optional.empty();
        }
        return Optional.of(x);
    }

    /**
     * A point of the fiber {x integer : A x = b}, not necessarily nonnegative.
     *
     * @throws InfeasibleRelaxationException if the fiber is empty
     */
    public long[] fiberSolution(final long[] b) {
        return solve(b).orElseThrow(() -> new InfeasibleRelaxationException(
                "A x = b has no integer solution for b = " + Arrays.toString(b)));
    }

    /**
     * Returns the normalized upper row HNF of a lattice basis, so that every entry above a pivot is
     * non-positive and smaller in magnitude than the pivot. Rows generate the same lattice as the input.
     */
    public static long[][] toNormalizedHnf(final long[][] basis, final int columns) {
        return HermiteNormalForm.normalize(HermiteNormalForm.of(basis, columns).toLongMatrix());
    }

    /**
     * Lifts a vector of a projected lattice back to the full lattice.
     *
     * @param v a vector in the lattice generated by the rows of projectedBasis
     * @param projectedBasis the selected columns of latticeBasis, row for row
     * @param latticeBasis the full lattice basis
     * @return the combination of latticeBasis rows with the same coefficients that produce v from
     *         projectedBasis
     */
    public static long[] liftVector(final long[] v, final long[][] projectedBasis, final long[][] latticeBasis) {
        Preconditions.checkArgument(projectedBasis.length == latticeBasis.length,
                                    "Projected basis has %s rows, lattice basis has %s",
                                    projectedBasis.length, latticeBasis.length);
        final int rows = projectedBasis.length;
        final long[][] columnBasis = IntegerMatrices.transpose(projectedBasis, v.length);
        final Optional<long[]> coefficients = Lattice.of(columnBasis, rows).solve(v);
        Preconditions.checkArgument(coefficients.isPresent(), "%s is not in the projected lattice",
                                    Arrays.toString(v));
        final int n = rows == 0 ? 0 : latticeBasis[0].length;
        final long[] lifted = new long[n];
        for (int k = 0; k < rows; k++) {
            final long coefficient = coefficients.get()[k];
            for (int j = 0; j < n; j++) {
                lifted[j] = Math.addExact(lifted[j], Math.multiplyExact(coefficient, latticeBasis[k][j]));
            }
        }
        return lifted;
    }

    public static boolean inKernel(final long[][] a, final long[] v) {
        return IntegerMatrices.isZero(IntegerMatrices.multiply(a, v));
    }
}
