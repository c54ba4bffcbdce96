/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * An external LP/IP solver. Implementations are expected to be stateless with respect to the programs they
 * receive, so a single oracle can serve any number of instances.
 *
 * Every method may throw {@link com.vmware.ipmatrix.SolverException} when the backend reports a status
 * outside of {@link SolveStatus}.
 */
public interface LpOracle {

    /**
     * Solves the program with continuous variables.
     */
    RelaxationResult solveRelaxation(LinearProgram program);

    /**
     * Solves the program with integer variables.
     */
    IntegerResult solveInteger(LinearProgram program);

    /**
     * Columns that are basic in an optimal basis of the linear relaxation. Implementations that can control
     * the solver should return a basis made of structural columns only, one per row.
     *
     * @throws IllegalStateException if the relaxation has no optimum
     */
    default boolean[] optimalBasis(final LinearProgram program) {
        final RelaxationResult result = solveRelaxation(program);
        Preconditions.checkState(result.isOptimal(), "No optimal basis for %s: %s", program.name(),
                                 result.status());
        return result.basis();
    }

    /**
     * Decided on the constraints alone: the objective is replaced by zero, so an unbounded program counts
     * as feasible whatever status the backend reports for it.
     */
    default boolean isFeasible(final LinearProgram program) {
        return solveRelaxation(program.withObjective(new double[program.columns()])).status()
                != SolveStatus.INFEASIBLE;
    }

    /**
     * Assumes the program is feasible.
     */
    default boolean isBounded(final LinearProgram program) {
        return !solveRelaxation(program).status().isUnbounded();
    }

    /**
     * @return the optimal dual values, one per row, or empty if the relaxation has no optimum
     */
    default Optional<double[]> duals(final LinearProgram program) {
        final RelaxationResult result = solveRelaxation(program);
        return result.isOptimal() ? Optional.of(result.duals()) : Optional.empty();
    }
}
