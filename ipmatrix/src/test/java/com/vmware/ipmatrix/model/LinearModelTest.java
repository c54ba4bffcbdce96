/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LinearModelTest {

    @Test
    public void variablesAreIndexedInCreationOrder() {
        final LinearModel model = new LinearModel();
        final Variable x = model.newIntVar(0, 3, "x");
        final Variable b = model.newBoolVar("b");
        final Variable y = model.newVar("y", VariableKind.CONTINUOUS);
        assertEquals(0, x.index());
        assertEquals(1, b.index());
        assertEquals(2, y.index());
        assertTrue(b.isBinary());
        assertFalse(x.isBinary());
        assertEquals(VariableKind.CONTINUOUS, y.kind());
        assertEquals(3, model.bounds().size());
        assertTrue(model.owns(y));
        assertFalse(new LinearModel().owns(y));
    }

    @Test
    public void constraintsAndObjective() {
        final LinearModel model = new LinearModel();
        final Variable x = model.newIntVar(0, 3, "x");
        final Variable y = model.newIntVar(0, 3, "y");
        final LinearConstraint c = model.addGreaterOrEqual(
                LinearExpr.weightedSum(new Variable[]{x, y}, new double[]{2, -1}), 1);
        assertEquals(LinearConstraint.Direction.GREATER_OR_EQUAL, c.direction());
        assertEquals(2, c.expression().terms().size());
        assertEquals(1, model.constraints().size());
        assertEquals(ObjectiveSense.MINIMIZE, model.sense());
        model.maximize(LinearExpr.sum(x, y));
        assertEquals(ObjectiveSense.MAXIMIZE, model.sense());
        assertEquals(2, model.objective().terms().size());
    }

    @Test
    public void emptyDomain() {
        assertThrows(IllegalArgumentException.class, () -> new LinearModel().newIntVar(3, 2, "x"));
        assertThrows(IllegalArgumentException.class,
                     () -> LinearExpr.weightedSum(new Variable[0], new double[]{1}));
    }
}
