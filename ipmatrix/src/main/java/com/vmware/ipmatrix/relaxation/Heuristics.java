/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import com.vmware.ipmatrix.IPInstance;
import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.LpOracle;
import com.vmware.ipmatrix.backend.RelaxationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;

/**
 * LP-based heuristics. None of them fails when the LP has no optimum: they return a sentinel and let the
 * caller fall back.
 */
public final class Heuristics {
    private static final Logger LOG = LoggerFactory.getLogger(Heuristics.class);

    private Heuristics() {
    }

    /**
     * Minimizes v * w over the weights w >= 0 with L w = 0 and sum(w) == 1, where L is the lattice basis and v
     * the fiber solution (Malkin's truncation weight).
     *
     * @return the optimal weight, or the zero weight if the LP has no optimum
     */
    public static WeightVector truncationWeight(final IPInstance instance) {
        final RelaxationResult result = instance.oracle().solveRelaxation(
                LpModels.weightProgram(instance.latticeBasis(), instance.fiberSolution()));
        if (!result.isOptimal()) {
            LOG.debug("No truncation weight ({}), truncation disabled", result.status());
            return WeightVector.zero(instance.n());
        }
        return new WeightVector(result.values(), result.objectiveValue());
    }

    /**
     * A^t y for the optimal duals y of min c x s.t. A x = b, x >= 0.
     *
     * @return the row span vector, or empty if the LP has no duals
     */
    public static Optional<double[]> optimalRowSpan(final LpOracle oracle, final long[][] a, final long[] b,
                                                    final double[] objective) {
        final Optional<double[]> duals = oracle.duals(LpModels.rowSpanProgram(a, b, objective));
        if (!duals.isPresent()) {
            LOG.debug("Row span program has no optimum");
            return Optional.empty();
        }
        final double[] y = duals.get();
        final double[] span = new double[objective.length];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < span.length; j++) {
                span[j] += a[i][j] * y[i];
            }
        }
        return Optional.of(span);
    }

    /**
     * A strictly positive vector in the row span of A, from the duals of max sum(x) s.t. A x = b, x >= 0.
     * Assumes that program is feasible and bounded.
     *
     * @return the vector, or empty if the LP has no duals
     */
    public static Optional<double[]> positiveRowSpan(final LpOracle oracle, final long[][] a, final long[] b) {
        final int n = a.length == 0 ? 0 : a[0].length;
        final double[] minusOnes = new double[n];
        Arrays.fill(minusOnes, -1.0);
        return optimalRowSpan(oracle, a, b, minusOnes).map(span -> {
            final double[] positive = new double[span.length];
            for (int j = 0; j < span.length; j++) {
                positive[j] = -span[j];
            }
            return positive;
        });
    }
}
