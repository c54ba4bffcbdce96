/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend.ortools;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.vmware.ipmatrix.SolverException;
import com.vmware.ipmatrix.backend.IntegerResult;
import com.vmware.ipmatrix.backend.LinearProgram;
import com.vmware.ipmatrix.backend.LpOracle;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.backend.SolveStatus;
import com.vmware.ipmatrix.model.VariableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers oracle queries with OR-Tools' MPSolver: GLOP for linear relaxations and SCIP for integer
 * programs by default. A new MPSolver is created for every query and released when it returns.
 *
 * A program with an objective that the backend reports infeasible is solved a second time with a zero
 * objective; if that has a point, the first answer meant unbounded and is reported as such.
 */
public class OrToolsOracle implements LpOracle {
    private static final Logger LOG = LoggerFactory.getLogger(OrToolsOracle.class);
    private static final String LP_SOLVER_DEFAULT = "GLOP";
    private static final String IP_SOLVER_DEFAULT = "SCIP";
    private static final int NUM_THREADS_DEFAULT = 1;
    private static final int NO_TIME_LIMIT = 0;
    private static final double ZERO_TOLERANCE = 1e-8;

    static {
        Loader.loadNativeLibraries();
    }

    private final String configLpSolver;
    private final String configIpSolver;
    private final int configNumThreads;
    private final int configMaxTimeInSeconds;
    private final boolean configPrintDiagnostics;

    private OrToolsOracle(final String configLpSolver, final String configIpSolver, final int configNumThreads,
                          final int configMaxTimeInSeconds, final boolean configPrintDiagnostics) {
        this.configLpSolver = configLpSolver;
        this.configIpSolver = configIpSolver;
        this.configNumThreads = configNumThreads;
        this.configMaxTimeInSeconds = configMaxTimeInSeconds;
        this.configPrintDiagnostics = configPrintDiagnostics;
    }

    @Override
    public RelaxationResult solveRelaxation(final LinearProgram program) {
        final MPSolver solver = newSolver(configLpSolver);
        try {
            final SolverModel model = SolverModel.of(solver, program, VariableKind.CONTINUOUS);
            final long start = System.nanoTime();
            final SolveStatus status = toSolveStatus(solver.solve());
            LOG.debug("{} ({} rows, {} columns) solved in {}us: {}", program.name(), program.rowCount(),
                      program.columns(), (System.nanoTime() - start) / 1000, status);
            if (status == SolveStatus.INFEASIBLE && hasObjective(program)
                    && solveRelaxation(withoutObjective(program)).isOptimal()) {
                LOG.debug("{} has feasible points, reporting it as unbounded", program.name());
                return RelaxationResult.of(SolveStatus.UNBOUNDED);
            }
            if (status != SolveStatus.OPTIMAL) {
                return RelaxationResult.of(status);
            }
            return RelaxationResult.optimal(solver.objective().value(), model.values(), model.basis(),
                                            model.duals());
        } finally {
            solver.delete();
        }
    }

    @Override
    public IntegerResult solveInteger(final LinearProgram program) {
        final MPSolver solver = newSolver(configIpSolver);
        try {
            final SolverModel model = SolverModel.of(solver, program, VariableKind.INTEGER);
            final long start = System.nanoTime();
            final SolveStatus status = toSolveStatus(solver.solve());
            LOG.debug("{} ({} rows, {} columns) solved over the integers in {}us: {}", program.name(),
                      program.rowCount(), program.columns(), (System.nanoTime() - start) / 1000, status);
            if (status == SolveStatus.INFEASIBLE && hasObjective(program)
                    && solveInteger(withoutObjective(program)).isOptimal()) {
                LOG.debug("{} has integer points, reporting it as unbounded", program.name());
                return IntegerResult.of(SolveStatus.UNBOUNDED);
            }
            if (status != SolveStatus.OPTIMAL) {
                return IntegerResult.of(status);
            }
            final double[] values = model.values();
            final long[] solution = new long[values.length];
            for (int j = 0; j < values.length; j++) {
                solution[j] = Math.round(values[j]);
            }
            return IntegerResult.optimal(solution, solver.objective().value());
        } finally {
            solver.delete();
        }
    }

    /**
     * Solves the relaxation, then re-optimizes with the optimal value fixed by an extra row and the sum of
     * all columns maximized. This yields a basis of structural columns instead of row slacks. The extra row
     * adds one basic variable; unless that row itself is basic, one basic column at value zero is dropped to
     * compensate.
     */
    @Override
    public boolean[] optimalBasis(final LinearProgram program) {
        final MPSolver solver = newSolver(configLpSolver);
        try {
            final SolverModel model = SolverModel.of(solver, program, VariableKind.CONTINUOUS);
            final SolveStatus first = toSolveStatus(solver.solve());
            Preconditions.checkState(first == SolveStatus.OPTIMAL, "No optimal basis for %s: %s",
                                     program.name(), first);
            final boolean[] firstBasis = model.basis();
            final double optimum = solver.objective().value();

            final MPConstraint objectiveRow = solver.makeConstraint(optimum, optimum, "objective");
            final MPObjective objective = solver.objective();
            for (int j = 0; j < program.columns(); j++) {
                objectiveRow.setCoefficient(model.variable(j), program.objective(j));
            }
            objective.clear();
            for (int j = 0; j < program.columns(); j++) {
                objective.setCoefficient(model.variable(j), 1.0);
            }
            objective.setMaximization();
            final MPSolver.ResultStatus second = solver.solve();
            if (second != MPSolver.ResultStatus.OPTIMAL) {
                LOG.warn("Re-optimization of {} ended with {}, using the basis of the first solve",
                         program.name(), second);
                return firstBasis;
            }
            boolean foundZero = objectiveRow.basisStatus() == MPSolver.BasisStatus.BASIC;
            final boolean[] basis = new boolean[program.columns()];
            for (int j = 0; j < program.columns(); j++) {
                final MPVariable x = model.variable(j);
                if (x.basisStatus() != MPSolver.BasisStatus.BASIC) {
                    continue;
                }
                if (!foundZero && Math.abs(x.solutionValue()) < ZERO_TOLERANCE) {
                    foundZero = true;
                    continue;
                }
                basis[j] = true;
            }
            return basis;
        } finally {
            solver.delete();
        }
    }

    private MPSolver newSolver(final String solverId) {
        final MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            throw new SolverException("OR-Tools solver backend is not available: " + solverId);
        }
        if (configPrintDiagnostics) {
            solver.enableOutput();
        } else {
            solver.suppressOutput();
        }
        if (configMaxTimeInSeconds > NO_TIME_LIMIT) {
            solver.setTimeLimit(configMaxTimeInSeconds * 1000L);
        }
        if (configNumThreads > 1 && !solver.setNumThreads(configNumThreads)) {
            LOG.debug("{} does not support {} threads", solverId, configNumThreads);
        }
        return solver;
    }

    private static boolean hasObjective(final LinearProgram program) {
        for (final double x : program.objective()) {
            if (x != 0.0) {
                return true;
            }
        }
        return false;
    }

    private static LinearProgram withoutObjective(final LinearProgram program) {
        return program.withObjective(new double[program.columns()]);
    }

    /**
     * MPSolver folds "infeasible or unbounded" into INFEASIBLE. The solve methods tell the two apart by
     * solving again without the objective, so INFEASIBLE here only means the constraints may have no point.
     */
    @VisibleForTesting
    static SolveStatus toSolveStatus(final MPSolver.ResultStatus status) {
        switch (status) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case UNBOUNDED:
                return SolveStatus.UNBOUNDED;
            default:
                throw new SolverException("Solver returned a status the oracle cannot interpret",
                                          status.toString());
        }
    }

    /**
     * The MPSolver variables and constraints created for one program.
     */
    private static final class SolverModel {
        private final MPVariable[] variables;
        private final MPConstraint[] constraints;

        private SolverModel(final MPVariable[] variables, final MPConstraint[] constraints) {
            this.variables = variables;
            this.constraints = constraints;
        }

        static SolverModel of(final MPSolver solver, final LinearProgram program, final VariableKind kind) {
            final double infinity = MPSolver.infinity();
            final MPVariable[] variables = new MPVariable[program.columns()];
            for (int j = 0; j < variables.length; j++) {
                final double lb = program.isNonnegative(j) ? 0.0 : -infinity;
                final String name = "x" + j;
                variables[j] = kind == VariableKind.INTEGER ? solver.makeIntVar(lb, infinity, name)
                                                            : solver.makeNumVar(lb, infinity, name);
            }
            final MPConstraint[] constraints = new MPConstraint[program.rowCount()];
            for (int i = 0; i < constraints.length; i++) {
                final double rhs = program.rhs(i);
                final MPConstraint constraint;
                switch (program.direction(i)) {
                    case LESS_OR_EQUAL:
                        constraint = solver.makeConstraint(-infinity, rhs, "r" + i);
                        break;
                    case GREATER_OR_EQUAL:
                        constraint = solver.makeConstraint(rhs, infinity, "r" + i);
                        break;
                    case EQUAL:
                        constraint = solver.makeConstraint(rhs, rhs, "r" + i);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown direction " + program.direction(i));
                }
                final long[] row = program.row(i);
                for (int j = 0; j < row.length; j++) {
                    if (row[j] != 0) {
                        constraint.setCoefficient(variables[j], row[j]);
                    }
                }
                constraints[i] = constraint;
            }
            final MPObjective objective = solver.objective();
            for (int j = 0; j < variables.length; j++) {
                objective.setCoefficient(variables[j], program.objective(j));
            }
            objective.setMinimization();
            return new SolverModel(variables, constraints);
        }

        MPVariable variable(final int j) {
            return variables[j];
        }

        double[] values() {
            final double[] values = new double[variables.length];
            for (int j = 0; j < variables.length; j++) {
                values[j] = variables[j].solutionValue();
            }
            return values;
        }

        boolean[] basis() {
            final boolean[] basis = new boolean[variables.length];
            for (int j = 0; j < variables.length; j++) {
                basis[j] = variables[j].basisStatus() == MPSolver.BasisStatus.BASIC;
            }
            return basis;
        }

        double[] duals() {
            final double[] duals = new double[constraints.length];
            for (int i = 0; i < constraints.length; i++) {
                duals[i] = constraints[i].dualValue();
            }
            return duals;
        }
    }

    public static class Builder {
        private String lpSolver = LP_SOLVER_DEFAULT;
        private String ipSolver = IP_SOLVER_DEFAULT;
        private int numThreads = NUM_THREADS_DEFAULT;
        private int maxTimeInSeconds = NO_TIME_LIMIT;
        private boolean printDiagnostics = false;

        /**
         * MPSolver backend for linear relaxations.
         * @param lpSolver a solver id accepted by MPSolver.createSolver. Defaults to {@value LP_SOLVER_DEFAULT}.
         * @return the current Builder object with `lpSolver` set
         */
        @CanIgnoreReturnValue
        public Builder setLpSolver(final String lpSolver) {
            this.lpSolver = lpSolver;
            return this;
        }

        /**
         * MPSolver backend for integer programs.
         * @param ipSolver a solver id accepted by MPSolver.createSolver. Defaults to {@value IP_SOLVER_DEFAULT}.
         * @return the current Builder object with `ipSolver` set
         */
        @CanIgnoreReturnValue
        public Builder setIpSolver(final String ipSolver) {
            this.ipSolver = ipSolver;
            return this;
        }

        /**
         * Number of solver threads, for backends that support it.
         * @param numThreads number of solver threads to use. Defaults to {@value NUM_THREADS_DEFAULT}.
         * @return the current Builder object with `numThreads` set
         */
        @CanIgnoreReturnValue
        public Builder setNumThreads(final int numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        /**
         * Per-query timeout. A query that times out without a proven optimum raises a SolverException.
         * @param maxTimeInSeconds timeout value in seconds; 0 means no limit, which is the default.
         * @return the current Builder object with `maxTimeInSeconds` set
         */
        @CanIgnoreReturnValue
        public Builder setMaxTimeInSeconds(final int maxTimeInSeconds) {
            Preconditions.checkArgument(maxTimeInSeconds >= 0, "Negative time limit %s", maxTimeInSeconds);
            this.maxTimeInSeconds = maxTimeInSeconds;
            return this;
        }

        /**
         * Configures whether the backends print their own logs.
         * @param printDiagnostics true to enable solver output. Defaults to false.
         * @return the current Builder object with `printDiagnostics` set
         */
        @CanIgnoreReturnValue
        public Builder setPrintDiagnostics(final boolean printDiagnostics) {
            this.printDiagnostics = printDiagnostics;
            return this;
        }

        public OrToolsOracle build() {
            return new OrToolsOracle(lpSolver, ipSolver, numThreads, maxTimeInSeconds, printDiagnostics);
        }
    }
}
