/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.IPInstance;
import com.vmware.ipmatrix.backend.LinearProgram;
import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.lattice.Lattice;
import com.vmware.ipmatrix.linalg.IntegerMatrices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Support for project-and-lift: restricting the lattice to a subset of the variables, building the
 * objective that drives a lifting step, and lifting vectors back to the full lattice.
 */
public final class ProjectAndLift {
    private static final Logger LOG = LoggerFactory.getLogger(ProjectAndLift.class);
    private static final double OBJECTIVE_TOLERANCE = 1e-6;

    private ProjectAndLift() {
    }

    public static LatticeProjection latticeBasisProjection(final IPInstance instance,
                                                           final VariableSelection selection) {
        final int n = instance.n();
        final int[] columns;
        switch (selection) {
            case ANY:
                columns = independentColumns(instance.latticeBasis(), n);
                break;
            case SIMPLEX_BASIS:
                columns = IntegerMatrices.complement(simplexBasis(instance), n);
                break;
            default:
                throw new IllegalArgumentException("Unknown variable selection " + selection);
        }
        final int[] sigma = IntegerMatrices.complement(columns, n);
        final long[][] selected = IntegerMatrices.selectColumns(instance.latticeBasis(), columns);
        final long[][] normalized = Lattice.toNormalizedHnf(selected, columns.length);
        LOG.debug("Projected the lattice onto {} of {} variables ({})", columns.length, n, selection);
        return new LatticeProjection(normalized, selected, columns, sigma);
    }

    /**
     * Columns of the lattice basis that increase its rank, scanning left to right.
     */
    private static int[] independentColumns(final long[][] basis, final int n) {
        return IntegerMatrices.independentRows(IntegerMatrices.transpose(basis, n), basis.length);
    }

    /**
     * Indices of a set of linearly independent columns of A with rank(A) elements, starting from an optimal
     * LP basis. Numerically dependent basis columns are dropped, then the set is completed left to right,
     * which is needed when the objective is linearly dependent with the constraints.
     */
    private static int[] simplexBasis(final IPInstance instance) {
        final long[][] a = instance.a();
        final int n = instance.n();
        final boolean[] basis = instance.optimalBasis();
        int rank = columnRank(a, basis);
        while (rank < IntegerMatrices.indicesOf(basis).length) {
            boolean removed = false;
            for (int j = 0; j < n && !removed; j++) {
                if (!basis[j]) {
                    continue;
                }
                basis[j] = false;
                if (columnRank(a, basis) == rank) {
                    removed = true;
                } else {
                    basis[j] = true;
                }
            }
            Preconditions.checkState(removed, "No dependent column found in the optimal basis");
        }
        final int targetRank = IntegerMatrices.rank(a, n);
        for (int j = 0; j < n && rank < targetRank; j++) {
            if (basis[j]) {
                continue;
            }
            basis[j] = true;
            final int newRank = columnRank(a, basis);
            if (newRank > rank) {
                rank = newRank;
            } else {
                basis[j] = false;
            }
        }
        return IntegerMatrices.indicesOf(basis);
    }

    private static int columnRank(final long[][] a, final boolean[] columns) {
        final int[] indices = IntegerMatrices.indicesOf(columns);
        return IntegerMatrices.rank(IntegerMatrices.selectColumns(a, indices), indices.length);
    }

    /**
     * Builds the instance whose objective c satisfies c[sigma] == 0 and c * u == -u[j] for every row u of the
     * lattice basis, and c >= 0 outside sigma. The constraints, permutation and lattice data of the instance
     * are kept.
     *
     * @throws IllegalStateException if the oracle finds no such objective or the objective fails either
     *                               property
     */
    public static IPInstance reconstructObjective(final IPInstance instance, final int j, final int[] sigma) {
        final long[][] a = instance.a();
        final int n = instance.n();
        final LinearProgram farkas = LpModels.farkasProgram(a, n, j, sigma);
        final RelaxationResult result = instance.oracle().solveRelaxation(farkas);
        Preconditions.checkState(result.isOptimal(), "The objective program for variable %s must be feasible, got %s",
                                 j, result.status());
        final double[] y = result.values();
        final long[] target = LpModels.farkasTarget(n, j);
        final double[] c = new double[n];
        for (int k = 0; k < n; k++) {
            double ck = target[k];
            for (int i = 0; i < a.length; i++) {
                ck -= a[i][k] * y[i];
            }
            c[k] = Math.abs(ck) < OBJECTIVE_TOLERANCE ? 0.0 : ck;
        }
        for (final int s : sigma) {
            Preconditions.checkState(c[s] == 0.0, "Reconstructed objective is %s on variable %s of sigma", (Object) c[s], s);
        }
        for (final long[] u : instance.latticeBasis()) {
            double cu = 0.0;
            for (int k = 0; k < n; k++) {
                cu += c[k] * u[k];
            }
            Preconditions.checkState(Math.abs(cu + u[j]) < OBJECTIVE_TOLERANCE,
                                     "Reconstructed objective gives %s on lattice vector %s, expected %s",
                                     cu, Arrays.toString(u), -u[j]);
        }
        LOG.debug("Objective for variable {}: {}", j, Arrays.toString(c));
        return instance.withObjective(c);
    }

    /**
     * Lifts a vector of a projected lattice to the full lattice of instance.
     */
    public static long[] liftVector(final long[] v, final LatticeProjection projection, final IPInstance instance) {
        return Lattice.liftVector(v, projection.selectedColumns(), instance.latticeBasis());
    }
}
