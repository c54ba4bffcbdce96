/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.backend.SolveStatus;
import com.vmware.ipmatrix.backend.StubOracle;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HeuristicsTest {

    @Test
    public void noTruncationWithoutOptimum() {
        final StubOracle oracle = new StubOracle()
                .respond(LpModels.WEIGHT, p -> RelaxationResult.of(SolveStatus.INFEASIBLE));
        final WeightVector w = Heuristics.truncationWeight(RelaxationsTest.baseInstance(oracle));
        assertTrue(w.isZero());
        assertEquals(3, w.weights().length);
        assertEquals(0.0, w.value());
    }

    @Test
    public void truncationWeightFromOptimum() {
        final StubOracle oracle = new StubOracle()
                .respond(LpModels.WEIGHT, p -> RelaxationResult.optimal(0.5, new double[]{0.25, 0.5, 0.25},
                                                                        new boolean[3],
                                                                        new double[p.rowCount()]));
        final WeightVector w = Heuristics.truncationWeight(RelaxationsTest.baseInstance(oracle));
        assertFalse(w.isZero());
        assertArrayEquals(new double[]{0.25, 0.5, 0.25}, w.weights(), 1e-12);
        assertEquals(0.5, w.value(), 1e-12);
        assertEquals(LpModels.WEIGHT, oracle.queries().get(oracle.queries().size() - 1).name());
    }

    @Test
    public void positiveRowSpanFromDuals() {
        final StubOracle oracle = new StubOracle()
                .respond(LpModels.ROW_SPAN, p -> RelaxationResult.optimal(-2.0, new double[]{2, 0},
                                                                          new boolean[]{true, false},
                                                                          new double[]{-1}));
        final Optional<double[]> span = Heuristics.positiveRowSpan(oracle, new long[][]{{1, 1}}, new long[]{2});
        assertTrue(span.isPresent());
        assertArrayEquals(new double[]{1, 1}, span.get(), 1e-12);
    }

    @Test
    public void rowSpanWithoutOptimum() {
        final StubOracle oracle = new StubOracle()
                .respond(LpModels.ROW_SPAN, p -> RelaxationResult.of(SolveStatus.UNBOUNDED));
        assertFalse(Heuristics.optimalRowSpan(oracle, new long[][]{{1, -1}}, new long[]{0},
                                              new double[]{-1, 0}).isPresent());
    }
}
