/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

/**
 * Termination statuses an {@link LpOracle} may report. Anything else is a {@link
 * com.vmware.ipmatrix.SolverException}.
 */
public enum SolveStatus {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    DUAL_INFEASIBLE;

    public boolean isUnbounded() {
        return this == UNBOUNDED || this == DUAL_INFEASIBLE;
    }
}
