/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.model.LinearConstraint.Direction;

import java.util.Arrays;

/**
 * The auxiliary programs the instance engine asks the oracle about.
 */
public final class LpModels {
    public static final String RELAXATION = "relaxation";
    public static final String RAY_PREFIX = "ray-";
    public static final String INTEGER_RAY_PREFIX = "integer-ray-";
    public static final String FARKAS_PREFIX = "farkas-";
    public static final String WEIGHT = "weight";
    public static final String ROW_SPAN = "row-span";

    private LpModels() {
    }

    /**
     * The linear relaxation min c x s.t. A x = b, x >= 0 on the nonnegative mask.
     */
    public static LinearProgram relaxation(final long[][] a, final long[] b, final double[] objective,
                                           final boolean[] nonnegative) {
        return LinearProgram.equalities(RELAXATION, a, b, objective, nonnegative);
    }

    /**
     * min -x_i s.t. A x = 0, x_i <= 1, x >= 0 on the nonnegative mask.
     *
     * The feasible set is the recession cone of {A x = b} cut by x_i <= 1, so the program always has an
     * optimum. It is 0 iff x_i is bounded above on every nonempty fiber, and -1 otherwise.
     */
    public static LinearProgram rayProgram(final long[][] a, final boolean[] nonnegative, final int i) {
        final int n = nonnegative.length;
        Preconditions.checkElementIndex(i, n);
        final double[] objective = new double[n];
        objective[i] = -1.0;
        final LinearProgram.Builder builder = LinearProgram.builder(RAY_PREFIX + i, n)
                .setObjective(objective)
                .setNonnegative(nonnegative);
        for (final long[] row : a) {
            builder.addRow(row, Direction.EQUAL, 0);
        }
        return builder.addRow(unit(n, i), Direction.LESS_OR_EQUAL, 1).build();
    }

    /**
     * min u_i s.t. A u = 0, u >= 0 on the nonnegative mask, u_i >= 1, meant to be solved over the integers.
     * A solution proves that variable i is unbounded; infeasibility proves it bounded.
     */
    public static LinearProgram integerRayProgram(final long[][] a, final boolean[] nonnegative, final int i) {
        final int n = nonnegative.length;
        Preconditions.checkElementIndex(i, n);
        final double[] objective = new double[n];
        objective[i] = 1.0;
        final LinearProgram.Builder builder = LinearProgram.builder(INTEGER_RAY_PREFIX + i, n)
                .setObjective(objective)
                .setNonnegative(nonnegative);
        for (final long[] row : a) {
            builder.addRow(row, Direction.EQUAL, 0);
        }
        return builder.addRow(unit(n, i), Direction.GREATER_OR_EQUAL, 1).build();
    }

    /**
     * Feasibility program over free y (one per row of A):
     *
     * <pre>
     * (A^t y)_k == w_k   for k in sigma
     * (A^t y)_k <= w_k   otherwise
     * </pre>
     *
     * where w = -e_j. By Farkas' lemma a solution y gives c = w - A^t y with c[sigma] == 0, c >= 0 elsewhere
     * and c * u == -u_j for every u in ker(A).
     *
     * @see #farkasTarget(int, int)
     */
    public static LinearProgram farkasProgram(final long[][] a, final int n, final int j, final int[] sigma) {
        Preconditions.checkElementIndex(j, n);
        final int m = a.length;
        final boolean[] inSigma = new boolean[n];
        for (final int s : sigma) {
            Preconditions.checkElementIndex(s, n);
            inSigma[s] = true;
        }
        final long[] target = farkasTarget(n, j);
        final LinearProgram.Builder builder = LinearProgram.builder(FARKAS_PREFIX + j, m);
        for (int k = 0; k < n; k++) {
            final long[] column = new long[m];
            for (int i = 0; i < m; i++) {
                column[i] = a[i][k];
            }
            builder.addRow(column, inSigma[k] ? Direction.EQUAL : Direction.LESS_OR_EQUAL, target[k]);
        }
        return builder.build();
    }

    /**
     * The right-hand side -e_j of {@link #farkasProgram}.
     */
    public static long[] farkasTarget(final int n, final int j) {
        final long[] target = new long[n];
        target[j] = -1;
        return target;
    }

    /**
     * min b x s.t. L x = 0, sum(x) == 1, x >= 0, where L is a lattice basis and b a point of the fiber.
     */
    public static LinearProgram weightProgram(final long[][] latticeBasis, final long[] fiberSolution) {
        final int n = fiberSolution.length;
        final boolean[] nonnegative = new boolean[n];
        Arrays.fill(nonnegative, true);
        final LinearProgram.Builder builder = LinearProgram.builder(WEIGHT, n)
                .setObjective(Arrays.stream(fiberSolution).asDoubleStream().toArray())
                .setNonnegative(nonnegative);
        for (final long[] row : latticeBasis) {
            builder.addRow(row, Direction.EQUAL, 0);
        }
        final long[] ones = new long[n];
        Arrays.fill(ones, 1);
        return builder.addRow(ones, Direction.EQUAL, 1).build();
    }

    /**
     * min c x s.t. A x = b, x >= 0. Its duals y give the row span vector A^t y.
     */
    public static LinearProgram rowSpanProgram(final long[][] a, final long[] b, final double[] objective) {
        final boolean[] nonnegative = new boolean[objective.length];
        Arrays.fill(nonnegative, true);
        return LinearProgram.equalities(ROW_SPAN, a, b, objective, nonnegative);
    }

    private static long[] unit(final int n, final int i) {
        final long[] e = new long[n];
        e[i] = 1;
        return e;
    }
}
