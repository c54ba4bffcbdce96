/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.common.base.Preconditions;

/**
 * Outcome of solving the linear relaxation of a {@link LinearProgram}. Values, basis and duals are only
 * available when the status is OPTIMAL.
 */
public final class RelaxationResult {
    private final SolveStatus status;
    private final double objectiveValue;
    private final double[] values;
    private final boolean[] basis;
    private final double[] duals;

    private RelaxationResult(final SolveStatus status, final double objectiveValue, final double[] values,
                             final boolean[] basis, final double[] duals) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.values = values;
        this.basis = basis;
        this.duals = duals;
    }

    /**
     * @param values primal values, one per column
     * @param basis true at column j iff it is basic in the optimal basis
     * @param duals one dual value per row; the derivative of the optimal value with respect to that row's rhs
     */
    public static RelaxationResult optimal(final double objectiveValue, final double[] values,
                                           final boolean[] basis, final double[] duals) {
        Preconditions.checkArgument(values.length == basis.length,
                                    "Got %s values but a basis of length %s", values.length, basis.length);
        return new RelaxationResult(SolveStatus.OPTIMAL, objectiveValue, values.clone(), basis.clone(),
                                    duals.clone());
    }

    public static RelaxationResult of(final SolveStatus status) {
        Preconditions.checkArgument(status != SolveStatus.OPTIMAL, "Optimal results carry a solution");
        return new RelaxationResult(status, Double.NaN, new double[0], new boolean[0], new double[0]);
    }

    public SolveStatus status() {
        return status;
    }

    public boolean isOptimal() {
        return status == SolveStatus.OPTIMAL;
    }

    public double objectiveValue() {
        checkOptimal();
        return objectiveValue;
    }

    public double[] values() {
        checkOptimal();
        return values.clone();
    }

    public boolean[] basis() {
        checkOptimal();
        return basis.clone();
    }

    public double[] duals() {
        checkOptimal();
        return duals.clone();
    }

    private void checkOptimal() {
        Preconditions.checkState(isOptimal(), "No solution available, status is %s", status);
    }

    @Override
    public String toString() {
        return isOptimal() ? "RelaxationResult{OPTIMAL, value=" + objectiveValue + "}"
                           : "RelaxationResult{" + status + "}";
    }
}
