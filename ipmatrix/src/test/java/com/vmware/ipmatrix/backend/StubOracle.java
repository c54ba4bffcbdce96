/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * An oracle that never calls a solver.
 *
 * Ray programs are answered from a predicate over variable indices that says which variables are unbounded.
 * Other programs are answered by responders registered by program name prefix, and otherwise with a feasible
 * optimum of value 0 whose basis is the configured one.
 */
public class StubOracle implements LpOracle {
    private final IntPredicate unbounded;
    private final Map<String, Function<LinearProgram, RelaxationResult>> responders = new LinkedHashMap<>();
    private final List<LinearProgram> queries = new ArrayList<>();
    @Nullable private boolean[] basis = null;
    @Nullable private SolveStatus relaxationStatus = null;

    public StubOracle(final IntPredicate unbounded) {
        this.unbounded = unbounded;
    }

    /**
     * Every variable bounded.
     */
    public StubOracle() {
        this(i -> false);
    }

    @CanIgnoreReturnValue
    public StubOracle setBasis(final boolean[] basis) {
        this.basis = basis.clone();
        return this;
    }

    /**
     * Status reported for the relaxation of an instance instead of a feasible optimum.
     */
    @CanIgnoreReturnValue
    public StubOracle setRelaxationStatus(final SolveStatus status) {
        this.relaxationStatus = status;
        return this;
    }

    @CanIgnoreReturnValue
    public StubOracle respond(final String namePrefix, final Function<LinearProgram, RelaxationResult> responder) {
        responders.put(namePrefix, responder);
        return this;
    }

    public List<LinearProgram> queries() {
        return queries;
    }

    @Override
    public RelaxationResult solveRelaxation(final LinearProgram program) {
        queries.add(program);
        if (program.name().startsWith(LpModels.RAY_PREFIX)) {
            final int i = Integer.parseInt(program.name().substring(LpModels.RAY_PREFIX.length()));
            return optimum(program, unbounded.test(i) ? -1.0 : 0.0);
        }
        for (final Map.Entry<String, Function<LinearProgram, RelaxationResult>> e : responders.entrySet()) {
            if (program.name().startsWith(e.getKey())) {
                return e.getValue().apply(program);
            }
        }
        if (relaxationStatus != null && program.name().equals(LpModels.RELAXATION)) {
            return RelaxationResult.of(relaxationStatus);
        }
        return optimum(program, 0.0);
    }

    @Override
    public IntegerResult solveInteger(final LinearProgram program) {
        queries.add(program);
        if (program.name().startsWith(LpModels.INTEGER_RAY_PREFIX)) {
            final int i = Integer.parseInt(program.name().substring(LpModels.INTEGER_RAY_PREFIX.length()));
            if (!unbounded.test(i)) {
                return IntegerResult.of(SolveStatus.INFEASIBLE);
            }
            final long[] ray = new long[program.columns()];
            ray[i] = 1;
            return IntegerResult.optimal(ray, 1.0);
        }
        return IntegerResult.of(SolveStatus.INFEASIBLE);
    }

    private RelaxationResult optimum(final LinearProgram program, final double value) {
        final boolean[] b = basis != null && basis.length == program.columns() ? basis
                                                                                : new boolean[program.columns()];
        return RelaxationResult.optimal(value, new double[program.columns()], b, new double[program.rowCount()]);
    }
}
