/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.linalg.IntegerMatrices;

import java.util.Arrays;

/**
 * Raw problem data {A, b, C, u, nonnegative} of
 *
 * <pre>
 * min C[0] x  s.t.  A x = b,  x_j >= 0 where nonnegative[j],  x_j <= u_j where u_j is set
 * </pre>
 *
 * Instances are immutable; every transformation returns a new object. A null entry of u means the variable
 * has no upper bound.
 */
public final class ProblemData {
    private final long[][] a;
    private final long[] b;
    private final double[][] c;
    private final Long[] u;
    private final boolean[] nonnegative;
    private final int n;

    public ProblemData(final long[][] a, final long[] b, final double[][] c, final Long[] u,
                       final boolean[] nonnegative) {
        this.n = nonnegative.length;
        Preconditions.checkArgument(a.length == b.length, "A has %s rows but b has length %s", a.length, b.length);
        for (int i = 0; i < a.length; i++) {
            Preconditions.checkArgument(a[i].length == n, "Row %s of A has length %s, expected %s",
                                        i, a[i].length, n);
        }
        Preconditions.checkArgument(c.length > 0, "C needs at least one objective row");
        for (final double[] row : c) {
            Preconditions.checkArgument(row.length == n, "C has %s columns, expected %s", row.length, n);
        }
        Preconditions.checkArgument(u.length == n, "u has length %s, expected %s", u.length, n);
        this.a = IntegerMatrices.copy(a);
        this.b = b.clone();
        this.c = copy(c);
        this.u = u.clone();
        this.nonnegative = nonnegative.clone();
    }

    /**
     * Same as the full constructor with every variable nonnegative.
     */
    public static ProblemData allNonnegative(final long[][] a, final long[] b, final double[][] c, final Long[] u) {
        final boolean[] nonnegative = new boolean[u.length];
        Arrays.fill(nonnegative, true);
        return new ProblemData(a, b, c, u, nonnegative);
    }

    public int m() {
        return a.length;
    }

    public int n() {
        return n;
    }

    public long[][] a() {
        return IntegerMatrices.copy(a);
    }

    public long[] b() {
        return b.clone();
    }

    public double[][] c() {
        return copy(c);
    }

    public double[] objective() {
        return c[0].clone();
    }

    public Long[] u() {
        return u.clone();
    }

    public boolean[] nonnegative() {
        return nonnegative.clone();
    }

    /**
     * Drops rows of A that are linear combinations of earlier rows.
     *
     * @throws InfeasibleRelaxationException if a dropped row contradicts the rows that were kept
     */
    public ProblemData withIndependentRows() {
        final int[] rows = IntegerMatrices.independentRows(a, n);
        if (rows.length == a.length) {
            return this;
        }
        if (!IntegerMatrices.isConsistent(a, b, n)) {
            throw new InfeasibleRelaxationException("A x = b is inconsistent: rank(A) < rank([A | b])");
        }
        return new ProblemData(IntegerMatrices.selectRows(a, rows), IntegerMatrices.select(b, rows), c, u,
                               nonnegative);
    }

    /**
     * Applies a variable permutation to the columns of A and C, to u and to the nonnegativity mask together.
     */
    public ProblemData permute(final VariablePermutation permutation) {
        Preconditions.checkArgument(permutation.size() == n, "Permutation of size %s applied to %s variables",
                                    permutation.size(), n);
        final long[][] newA = new long[a.length][];
        for (int i = 0; i < a.length; i++) {
            newA[i] = permutation.apply(a[i]);
        }
        final double[][] newC = new double[c.length][];
        for (int i = 0; i < c.length; i++) {
            newC[i] = permutation.apply(c[i]);
        }
        return new ProblemData(newA, b, newC, permutation.apply(u), permutation.apply(nonnegative));
    }

    public ProblemData withObjective(final double[][] newC) {
        return new ProblemData(a, b, newC, u, nonnegative);
    }

    public ProblemData withNonnegative(final boolean[] newNonnegative) {
        Preconditions.checkArgument(newNonnegative.length == n, "Mask has length %s, expected %s",
                                    newNonnegative.length, n);
        return new ProblemData(a, b, c, u, newNonnegative);
    }

    private static double[][] copy(final double[][] c) {
        final double[][] out = new double[c.length][];
        for (int i = 0; i < c.length; i++) {
            out[i] = c[i].clone();
        }
        return out;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProblemData)) {
            return false;
        }
        final ProblemData that = (ProblemData) o;
        return n == that.n && Arrays.deepEquals(a, that.a) && Arrays.equals(b, that.b)
                && Arrays.deepEquals(c, that.c) && Arrays.equals(u, that.u)
                && Arrays.equals(nonnegative, that.nonnegative);
    }

    @Override
    public int hashCode() {
        int result = Arrays.deepHashCode(a);
        result = 31 * result + Arrays.hashCode(b);
        result = 31 * result + Arrays.deepHashCode(c);
        result = 31 * result + Arrays.hashCode(u);
        result = 31 * result + Arrays.hashCode(nonnegative);
        return result;
    }

    @Override
    public String toString() {
        return "ProblemData{m=" + a.length + ", n=" + n + "}";
    }
}
