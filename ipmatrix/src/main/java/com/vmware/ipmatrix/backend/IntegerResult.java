/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Outcome of solving a {@link LinearProgram} over the integers. A solution is only available when the
 * status is OPTIMAL.
 */
public final class IntegerResult {
    private final SolveStatus status;
    private final long[] solution;
    private final double value;

    private IntegerResult(final SolveStatus status, final long[] solution, final double value) {
        this.status = status;
        this.solution = solution;
        this.value = value;
    }

    public static IntegerResult optimal(final long[] solution, final double value) {
        return new IntegerResult(SolveStatus.OPTIMAL, solution.clone(), value);
    }

    public static IntegerResult of(final SolveStatus status) {
        Preconditions.checkArgument(status != SolveStatus.OPTIMAL, "Optimal results carry a solution");
        return new IntegerResult(status, new long[0], Double.NaN);
    }

    public SolveStatus status() {
        return status;
    }

    public boolean isOptimal() {
        return status == SolveStatus.OPTIMAL;
    }

    public long[] solution() {
        Preconditions.checkState(isOptimal(), "No solution available, status is %s", status);
        return solution.clone();
    }

    public double value() {
        Preconditions.checkState(isOptimal(), "No solution available, status is %s", status);
        return value;
    }

    @Override
    public String toString() {
        return isOptimal() ? "IntegerResult{OPTIMAL, value=" + value + ", solution=" + Arrays.toString(solution) + "}"
                           : "IntegerResult{" + status + "}";
    }
}
