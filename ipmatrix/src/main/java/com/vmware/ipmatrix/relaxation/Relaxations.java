/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.IPInstance;
import com.vmware.ipmatrix.ProblemData;
import com.vmware.ipmatrix.linalg.DoubleMatrices;
import com.vmware.ipmatrix.linalg.IntegerMatrices;
import com.vmware.ipmatrix.model.LinearConstraint.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Derives new instances from existing ones. The source instance is never modified.
 *
 * Derived data is already in equality form, so it is built without normalization and without negating the
 * objective again. Variables are re-classified because the nonnegativity mask changes; the permutation of
 * a derived instance is therefore expressed relative to the variable order of its source.
 */
public final class Relaxations {
    private static final Logger LOG = LoggerFactory.getLogger(Relaxations.class);

    private Relaxations() {
    }

    /**
     * Keeps the nonnegativity constraints of the variables flagged in nonnegative and drops the others.
     *
     * If exactly m variables are relaxed and their columns A_s form a nonsingular matrix, the objective
     * becomes the reduced cost c_ns - c_s A_s^-1 A_ns on the kept variables and 0 on the relaxed ones.
     * Otherwise the relaxation is an extended one and the objective is carried over unchanged.
     */
    public static IPInstance nonnegativityRelaxation(final IPInstance instance, final boolean[] nonnegative) {
        Preconditions.checkArgument(nonnegative.length == instance.n(), "Mask has length %s, expected %s",
                                    nonnegative.length, instance.n());
        final int[] kept = IntegerMatrices.indicesOf(nonnegative);
        final int[] relaxed = IntegerMatrices.complement(kept, instance.n());
        final double[][] c;
        if (relaxed.length != instance.m()) {
            LOG.debug("{} variables relaxed for {} rows, keeping the objective", relaxed.length, instance.m());
            c = instance.c();
        } else if (IntegerMatrices.rank(IntegerMatrices.selectColumns(instance.a(), relaxed)) < instance.m()) {
            LOG.warn("Columns {} of the relaxed variables are singular, keeping the objective",
                     Arrays.toString(relaxed));
            c = instance.c();
        } else {
            c = reducedCosts(instance, kept, relaxed);
        }
        final ProblemData data = instance.data().withObjective(c).withNonnegative(nonnegative);
        return derive(instance, data);
    }

    private static double[][] reducedCosts(final IPInstance instance, final int[] kept, final int[] relaxed) {
        final long[][] a = instance.a();
        final double[] objective = instance.objective();
        final int m = a.length;
        // y = A_s^-t c_s, so that c_s A_s^-1 A_ns = y^t A_ns.
        final double[][] relaxedTransposed = new double[m][m];
        final double[] relaxedCosts = new double[m];
        for (int k = 0; k < m; k++) {
            for (int i = 0; i < m; i++) {
                relaxedTransposed[k][i] = a[i][relaxed[k]];
            }
            relaxedCosts[k] = objective[relaxed[k]];
        }
        final double[] y = DoubleMatrices.solve(relaxedTransposed, relaxedCosts);
        final double[][] c = new double[instance.c().length][instance.n()];
        for (final int j : kept) {
            double reduced = objective[j];
            for (int i = 0; i < m; i++) {
                reduced -= y[i] * a[i][j];
            }
            c[0][j] = reduced;
        }
        LOG.debug("Reduced cost objective for the relaxation: {}", Arrays.toString(c[0]));
        return c;
    }

    /**
     * Relaxes the nonnegativity of the variables that are basic in an optimal basis of the linear
     * relaxation, keeping it on the non-basic ones.
     *
     * @throws IllegalStateException if the oracle's basis does not have exactly m columns
     */
    public static IPInstance groupRelaxation(final IPInstance instance) {
        final boolean[] basis = instance.optimalBasis();
        final int basic = IntegerMatrices.indicesOf(basis).length;
        Preconditions.checkState(basic == instance.m(), "Optimal basis has %s columns, expected %s",
                                 basic, instance.m());
        final boolean[] nonbasic = new boolean[basis.length];
        for (int j = 0; j < basis.length; j++) {
            nonbasic[j] = !basis[j];
        }
        return nonnegativityRelaxation(instance, nonbasic);
    }

    /**
     * Removes the given variables. Only variables whose nonnegativity was already relaxed can be projected
     * away.
     *
     * @param awayFrom indices of the variables to drop, all at or beyond nonnegativeEnd
     */
    public static IPInstance projection(final IPInstance instance, final int[] awayFrom) {
        for (final int s : awayFrom) {
            Preconditions.checkArgument(s >= instance.nonnegativeEnd() && s < instance.n(),
                                        "Variable %s is nonnegative or out of range and cannot be projected away",
                                        s);
        }
        final int[] onto = IntegerMatrices.complement(awayFrom, instance.n());
        final ProblemData data = instance.data();
        final double[][] c = data.c();
        final double[][] projectedC = new double[c.length][];
        for (int r = 0; r < c.length; r++) {
            projectedC[r] = select(c[r], onto);
        }
        final Long[] u = data.u();
        final Long[] projectedU = new Long[onto.length];
        final boolean[] nonnegative = data.nonnegative();
        final boolean[] projectedNonnegative = new boolean[onto.length];
        for (int k = 0; k < onto.length; k++) {
            projectedU[k] = u[onto[k]];
            projectedNonnegative[k] = nonnegative[onto[k]];
        }
        final ProblemData projected = new ProblemData(IntegerMatrices.selectColumns(data.a(), onto), data.b(),
                                                      projectedC, projectedU, projectedNonnegative);
        return derive(instance, projected);
    }

    /**
     * Drops the coordinates listed in awayFrom.
     */
    public static long[] projectVector(final long[] v, final int[] awayFrom) {
        return IntegerMatrices.select(v, IntegerMatrices.complement(awayFrom, v.length));
    }

    /**
     * Appends the constraint row * x (direction) rhs. Inequalities get a new nonnegative slack column with a
     * zero objective and no upper bound.
     */
    public static IPInstance addConstraint(final IPInstance instance, final long[] row, final long rhs,
                                           final Direction direction) {
        Preconditions.checkArgument(row.length == instance.n(), "Row has length %s, expected %s",
                                    row.length, instance.n());
        final ProblemData data = instance.data();
        final int m = data.m();
        final int n = data.n();
        final int newN = direction == Direction.EQUAL ? n : n + 1;
        final long[][] a = data.a();
        final long[][] newA = new long[m + 1][];
        for (int i = 0; i < m; i++) {
            newA[i] = Arrays.copyOf(a[i], newN);
        }
        newA[m] = Arrays.copyOf(row, newN);
        if (direction != Direction.EQUAL) {
            newA[m][n] = direction == Direction.LESS_OR_EQUAL ? 1 : -1;
        }
        final long[] newB = Arrays.copyOf(data.b(), m + 1);
        newB[m] = rhs;
        final double[][] c = data.c();
        final double[][] newC = new double[c.length][];
        for (int r = 0; r < c.length; r++) {
            newC[r] = Arrays.copyOf(c[r], newN);
        }
        final Long[] newU = Arrays.copyOf(data.u(), newN);
        final boolean[] newNonnegative = Arrays.copyOf(data.nonnegative(), newN);
        if (newN > n) {
            newNonnegative[n] = true;
        }
        return derive(instance, new ProblemData(newA, newB, newC, newU, newNonnegative));
    }

    static IPInstance derive(final IPInstance source, final ProblemData data) {
        final IPInstance derived = IPInstance.builder(data)
                .setApplyNormalization(false)
                .setInvertObjective(false)
                .setBoundednessTest(source.boundednessTest())
                .build(source.oracle());
        LOG.debug("Derived instance with {} rows and {} variables from one with {} rows and {} variables",
                  derived.m(), derived.n(), source.m(), source.n());
        return derived;
    }

    private static double[] select(final double[] v, final int[] indices) {
        final double[] out = new double[indices.length];
        for (int k = 0; k < indices.length; k++) {
            out[k] = v[indices[k]];
        }
        return out;
    }
}
