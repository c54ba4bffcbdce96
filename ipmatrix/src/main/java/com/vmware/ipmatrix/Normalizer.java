/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings problem data into equality standard form. Starting from
 *
 * <pre>
 * min C x  s.t.  A x <= b,  x <= u
 * </pre>
 *
 * with k variables carrying an upper bound, the result is
 *
 * <pre>
 * [ A   I  0 ]        [ b   ]
 * [ UB  0  I ] x'  =  [ ubs ]
 * </pre>
 *
 * where UB holds one unit row per bounded variable. The m + k new columns are nonnegative slacks without
 * an upper bound and have a zero objective.
 */
public final class Normalizer {
    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    private Normalizer() {
    }

    /**
     * Always removes linearly dependent rows first. With applyNormalization unset, the result is otherwise
     * the input itself.
     *
     * @param invertObjective negates C, so that a maximization problem becomes a minimization one. Only
     *                        takes effect together with applyNormalization.
     * @throws InfeasibleRelaxationException if a dependent row contradicts the others
     */
    public static ProblemData normalize(final ProblemData data, final boolean applyNormalization,
                                        final boolean invertObjective) {
        final ProblemData independent = independentRows(data);
        return applyNormalization ? standardForm(independent, invertObjective) : independent;
    }

    /**
     * @throws InfeasibleRelaxationException if a dependent row contradicts the others
     */
    public static ProblemData independentRows(final ProblemData data) {
        final ProblemData independent = data.withIndependentRows();
        if (independent.m() < data.m()) {
            LOG.debug("Dropped {} linearly dependent rows out of {}", data.m() - independent.m(), data.m());
        }
        return independent;
    }

    /**
     * Adds the slack columns and upper bound rows. Assumes A has full row rank.
     */
    public static ProblemData standardForm(final ProblemData independent, final boolean invertObjective) {
        final long[][] a = independent.a();
        final long[] b = independent.b();
        final double[][] c = independent.c();
        final Long[] u = independent.u();
        final boolean[] nonnegative = independent.nonnegative();
        final int m = a.length;
        final int n = u.length;
        int k = 0;
        for (final Long ub : u) {
            if (ub != null) {
                k++;
            }
        }
        final int newM = m + k;
        final int newN = n + m + k;
        final long[][] newA = new long[newM][newN];
        final long[] newB = new long[newM];
        for (int i = 0; i < m; i++) {
            System.arraycopy(a[i], 0, newA[i], 0, n);
            newA[i][n + i] = 1;
            newB[i] = b[i];
        }
        int row = m;
        for (int j = 0; j < n; j++) {
            if (u[j] != null) {
                newA[row][j] = 1;
                newA[row][n + row] = 1;
                newB[row] = u[j];
                row++;
            }
        }
        final double sign = invertObjective ? -1.0 : 1.0;
        final double[][] newC = new double[c.length][newN];
        for (int r = 0; r < c.length; r++) {
            for (int j = 0; j < n; j++) {
                newC[r][j] = sign * c[r][j];
            }
        }
        final Long[] newU = new Long[newN];
        System.arraycopy(u, 0, newU, 0, n);
        final boolean[] newNonnegative = new boolean[newN];
        System.arraycopy(nonnegative, 0, newNonnegative, 0, n);
        for (int j = n; j < newN; j++) {
            newNonnegative[j] = true;
        }
        LOG.debug("Normalized {}x{} system with {} upper bounds into {}x{}", m, n, k, newM, newN);
        return new ProblemData(newA, newB, newC, newU, newNonnegative);
    }
}
