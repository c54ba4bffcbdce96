/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import javax.annotation.Nullable;

/**
 * The linear relaxation of one instance, bound to the oracle that solves it. Results are cached, so repeated
 * queries about the same instance cost one solve. Handles are never shared between instances: every derived
 * instance gets its own through {@link #derive(LinearProgram)}.
 */
public final class OracleHandle {
    private final LpOracle oracle;
    private final LinearProgram relaxation;
    @Nullable private RelaxationResult result = null;
    @Nullable private boolean[] basis = null;
    @Nullable private Boolean feasible = null;

    public OracleHandle(final LpOracle oracle, final LinearProgram relaxation) {
        this.oracle = oracle;
        this.relaxation = relaxation;
    }

    public LpOracle oracle() {
        return oracle;
    }

    /**
     * A fresh handle on the same oracle for another program. Nothing cached here carries over.
     */
    public OracleHandle derive(final LinearProgram program) {
        return new OracleHandle(oracle, program);
    }

    public synchronized RelaxationResult solve() {
        if (result == null) {
            result = oracle.solveRelaxation(relaxation);
        }
        return result;
    }

    /**
     * An optimal or unbounded relaxation is feasible. Anything else is settled by the oracle on the
     * constraints alone.
     */
    public synchronized boolean isFeasible() {
        if (feasible == null) {
            final SolveStatus status = solve().status();
            feasible = status == SolveStatus.OPTIMAL || status.isUnbounded() || oracle.isFeasible(relaxation);
        }
        return feasible;
    }

    public boolean isBounded() {
        return !solve().status().isUnbounded();
    }

    public synchronized boolean[] optimalBasis() {
        if (basis == null) {
            basis = oracle.optimalBasis(relaxation);
        }
        return basis.clone();
    }

    public IntegerResult solveInteger() {
        return oracle.solveInteger(relaxation);
    }
}
