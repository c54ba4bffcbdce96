/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import com.google.common.base.Preconditions;
import com.vmware.ipmatrix.backend.IntegerResult;
import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.LpOracle;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.backend.SolveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Decides, variable by variable, whether x_i is bounded above on the fibers of {A x = b, x >= 0 on the
 * nonnegative mask}. This only depends on A and the mask: x_i is bounded on one nonempty fiber iff it is
 * bounded on all of them iff no ray of the recession cone increases it.
 */
public final class VariableClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(VariableClassifier.class);
    private static final double RAY_THRESHOLD = -0.5;

    private final LpOracle oracle;
    private final BoundednessTest test;

    public VariableClassifier(final LpOracle oracle, final BoundednessTest test) {
        this.oracle = oracle;
        this.test = test;
    }

    public boolean[] bounded(final long[][] a, final boolean[] nonnegative) {
        final boolean[] bounded = new boolean[nonnegative.length];
        for (int i = 0; i < nonnegative.length; i++) {
            bounded[i] = isBounded(a, nonnegative, i);
        }
        LOG.debug("Boundedness by {}: {}", test, Arrays.toString(bounded));
        return bounded;
    }

    public boolean isBounded(final long[][] a, final boolean[] nonnegative, final int i) {
        switch (test) {
            case LINEAR_RELAXATION:
                return boundedByRelaxation(a, nonnegative, i);
            case INTEGER_RAY:
                return boundedByIntegerRay(a, nonnegative, i);
            default:
                throw new IllegalArgumentException("Unknown boundedness test " + test);
        }
    }

    private boolean boundedByRelaxation(final long[][] a, final boolean[] nonnegative, final int i) {
        final RelaxationResult result = oracle.solveRelaxation(LpModels.rayProgram(a, nonnegative, i));
        Preconditions.checkState(result.status() != SolveStatus.INFEASIBLE,
                                 "The recession cone of variable %s cannot be empty", i);
        // The ray program is capped at x_i <= 1, so its optimum is either 0 or -1.
        return result.isOptimal() && result.objectiveValue() > RAY_THRESHOLD;
    }

    private boolean boundedByIntegerRay(final long[][] a, final boolean[] nonnegative, final int i) {
        final IntegerResult result = oracle.solveInteger(LpModels.integerRayProgram(a, nonnegative, i));
        return result.status() == SolveStatus.INFEASIBLE;
    }
}
