/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend.ortools;

import com.google.ortools.linearsolver.MPSolver;
import com.vmware.ipmatrix.BoundednessTest;
import com.vmware.ipmatrix.IPInstance;
import com.vmware.ipmatrix.ModelExtractor;
import com.vmware.ipmatrix.SolverException;
import com.vmware.ipmatrix.backend.IntegerResult;
import com.vmware.ipmatrix.backend.LinearProgram;
import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.backend.SolveStatus;
import com.vmware.ipmatrix.linalg.IntegerMatrices;
import com.vmware.ipmatrix.model.LinearExpr;
import com.vmware.ipmatrix.model.LinearModel;
import com.vmware.ipmatrix.model.Variable;
import com.vmware.ipmatrix.model.VariableKind;
import com.vmware.ipmatrix.relaxation.Heuristics;
import com.vmware.ipmatrix.relaxation.ProjectAndLift;
import com.vmware.ipmatrix.relaxation.Relaxations;
import com.vmware.ipmatrix.relaxation.WeightVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs oracle queries and whole instances against the OR-Tools backends.
 */
public class OrToolsOracleTest {
    private static final double DELTA = 1e-6;

    private static OrToolsOracle oracle() {
        return new OrToolsOracle.Builder().build();
    }

    private static IPInstance twoRowInstance() {
        return IPInstance.builder(new long[][]{{1, 1, 0}, {0, 1, 1}}, new long[]{1, 1},
                                  new double[][]{{1, 2, 3}}, new Long[3])
                .setApplyNormalization(false)
                .build(oracle());
    }

    @Test
    public void relaxationWithDuals() {
        final LinearProgram lp = LpModels.rowSpanProgram(new long[][]{{1, 1}}, new long[]{2},
                                                         new double[]{-1, -1});
        final RelaxationResult result = oracle().solveRelaxation(lp);
        assertEquals(SolveStatus.OPTIMAL, result.status());
        assertEquals(-2.0, result.objectiveValue(), DELTA);
        assertEquals(-1.0, result.duals()[0], DELTA);
    }

    @Test
    public void positiveRowSpan() {
        final Optional<double[]> span = Heuristics.positiveRowSpan(oracle(), new long[][]{{1, 1}}, new long[]{2});
        assertTrue(span.isPresent());
        assertArrayEquals(new double[]{1, 1}, span.get(), DELTA);
    }

    @Test
    public void infeasibleRelaxation() {
        final LinearProgram lp = LpModels.relaxation(new long[][]{{1, 1}}, new long[]{-1}, new double[2],
                                                     new boolean[]{true, true});
        assertEquals(SolveStatus.INFEASIBLE, oracle().solveRelaxation(lp).status());
        assertFalse(oracle().isFeasible(lp));
    }

    @Test
    public void unboundedRelaxationIsNotInfeasible() {
        final LinearProgram lp = LpModels.relaxation(new long[][]{{1, -1}}, new long[]{1}, new double[]{-1, 0},
                                                     new boolean[]{true, true});
        assertTrue(oracle().solveRelaxation(lp).status().isUnbounded());
        assertTrue(oracle().isFeasible(lp));
        assertFalse(oracle().isBounded(lp));
    }

    @Test
    public void instanceWithUnboundedRelaxation() {
        final IPInstance instance = IPInstance.builder(new long[][]{{1, -1}}, new long[]{0},
                                                       new double[][]{{-1, 0}}, new Long[2])
                .setApplyNormalization(false)
                .build(oracle());
        assertFalse(instance.isBounded());
        assertEquals(0, instance.boundedEnd());
        assertEquals(2, instance.nonnegativeEnd());
        assertTrue(instance.isFeasibleSolution(new long[]{0, 0}));
        assertThrows(IllegalStateException.class, instance::linearRelaxation);
    }

    @Test
    public void solveInstance() {
        final IntegerResult result = twoRowInstance().solve();
        assertTrue(result.isOptimal());
        assertArrayEquals(new long[]{0, 1, 0}, result.solution());
        assertEquals(2.0, result.value(), DELTA);
    }

    @Test
    public void integerInfeasibleButFractionallyFeasible() {
        final LinearProgram lp = LpModels.relaxation(new long[][]{{2}}, new long[]{3}, new double[]{1},
                                                     new boolean[]{false});
        assertEquals(SolveStatus.OPTIMAL, oracle().solveRelaxation(lp).status());
        final IntegerResult integer = oracle().solveInteger(lp);
        assertEquals(SolveStatus.INFEASIBLE, integer.status());
    }

    @Test
    public void integerSolution() {
        final LinearProgram lp = LpModels.relaxation(new long[][]{{2, 3}}, new long[]{7}, new double[]{1, 1},
                                                     new boolean[]{true, true});
        final IntegerResult integer = oracle().solveInteger(lp);
        assertTrue(integer.isOptimal());
        assertArrayEquals(new long[]{2, 1}, integer.solution());
        assertEquals(3.0, integer.value(), DELTA);
    }

    @Test
    public void rayPrograms() {
        final boolean[] nonnegative = {true, true};
        final RelaxationResult unbounded = oracle().solveRelaxation(
                LpModels.rayProgram(new long[][]{{1, -1}}, nonnegative, 0));
        assertEquals(-1.0, unbounded.objectiveValue(), DELTA);
        final RelaxationResult bounded = oracle().solveRelaxation(
                LpModels.rayProgram(new long[][]{{1, 1}}, nonnegative, 0));
        assertEquals(0.0, bounded.objectiveValue(), DELTA);
    }

    @Test
    public void structuralOptimalBasis() {
        final LinearProgram lp = LpModels.relaxation(new long[][]{{1, 1}}, new long[]{2}, new double[]{1, 2},
                                                     new boolean[]{true, true});
        assertArrayEquals(new boolean[]{true, false}, oracle().optimalBasis(lp));
    }

    @Test
    public void statusMapping() {
        assertEquals(SolveStatus.OPTIMAL, OrToolsOracle.toSolveStatus(MPSolver.ResultStatus.OPTIMAL));
        assertEquals(SolveStatus.UNBOUNDED, OrToolsOracle.toSolveStatus(MPSolver.ResultStatus.UNBOUNDED));
        final SolverException e = assertThrows(SolverException.class,
                                               () -> OrToolsOracle.toSolveStatus(MPSolver.ResultStatus.FEASIBLE));
        assertEquals(Optional.of("FEASIBLE"), e.status());
    }

    @Test
    public void unknownBackend() {
        final OrToolsOracle oracle = new OrToolsOracle.Builder().setLpSolver("NO_SUCH_SOLVER").build();
        final LinearProgram lp = LpModels.relaxation(new long[][]{{1}}, new long[]{1}, new double[1],
                                                     new boolean[]{true});
        assertThrows(SolverException.class, () -> oracle.solveRelaxation(lp));
    }

    /**
     * x0 <= 5 and free, x1 free and absent from the constraints, x2 >= 0, x0 + x2 <= 4.
     */
    @ParameterizedTest
    @EnumSource(BoundednessTest.class)
    public void instanceFromModel(final BoundednessTest test) {
        final LinearModel model = new LinearModel();
        final Variable x0 = model.newVar("x0", VariableKind.INTEGER);
        model.setUpperBound(x0, 5);
        model.newVar("x1", VariableKind.INTEGER);
        final Variable x2 = model.newVar("x2", VariableKind.INTEGER);
        model.setLowerBound(x2, 0);
        model.addLessOrEqual(LinearExpr.sum(x0, x2), 4);
        model.minimize(LinearExpr.term(x2, 1));

        final IPInstance instance = IPInstance.builder(new ModelExtractor().extract(model))
                .setApplyNormalization(false)
                .setBoundednessTest(test)
                .build(oracle());
        assertEquals(5, instance.n());
        assertEquals(2, instance.m());
        assertArrayEquals(new int[]{2, 3, 4, 0, 1}, instance.permutation());
        assertEquals(0, instance.boundedEnd());
        assertEquals(3, instance.nonnegativeEnd());
        assertArrayEquals(new boolean[]{true, false, false, false, false}, instance.originallyBounded());
        assertTrue(instance.isBounded());
        assertEquals(0.0, instance.linearRelaxation(), DELTA);
        assertEquals(3, instance.latticeBasis().length);
        assertTrue(instance.inKernel(instance.latticeBasis()[0]));
        assertTrue(instance.inKernel(instance.latticeBasis()[2]));
        assertArrayEquals(instance.b(), IntegerMatrices.multiply(instance.a(), instance.fiberSolution()));
    }

    @Test
    public void fromModelMatchesExtraction() {
        final LinearModel model = new LinearModel();
        final Variable x = model.newIntVar(0, 3, "x");
        final Variable y = model.newIntVar(0, 3, "y");
        model.addLessOrEqual(LinearExpr.sum(x, y), 4);
        model.maximize(LinearExpr.sum(x, y));
        final IPInstance instance = IPInstance.fromModel(model, oracle());
        assertEquals(3, instance.m());
        assertEquals(5, instance.n());
        assertTrue(instance.variablePermutation().isIdentity());
        assertEquals(-4.0, instance.linearRelaxation(), DELTA);
    }

    @Test
    public void relaxationChangesBoundedness() {
        final IPInstance relaxed = Relaxations.nonnegativityRelaxation(twoRowInstance(),
                                                                       new boolean[]{true, false, false});
        assertArrayEquals(new double[]{2, 0, 0}, relaxed.objective(), DELTA);
        assertEquals(0, relaxed.boundedEnd());
        assertEquals(1, relaxed.nonnegativeEnd());
        assertTrue(relaxed.variablePermutation().isIdentity());
        assertEquals(0.0, relaxed.linearRelaxation(), DELTA);
    }

    @Test
    public void reconstructedObjective() {
        final IPInstance instance = twoRowInstance();
        final IPInstance reconstructed = ProjectAndLift.reconstructObjective(instance, 1, new int[]{0, 1});
        assertArrayEquals(new double[]{0, 0, 1}, reconstructed.objective(), DELTA);
    }

    @Test
    public void truncationWeight() {
        final WeightVector w = Heuristics.truncationWeight(twoRowInstance());
        assertFalse(w.isZero());
        assertEquals(0.5, w.value(), DELTA);
        assertEquals(0.5, w.weights()[1], DELTA);
    }
}
