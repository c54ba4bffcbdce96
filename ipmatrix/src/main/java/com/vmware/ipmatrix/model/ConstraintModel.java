/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

import java.util.List;

/**
 * What the extractor needs to know about a model. Implementations need not be backed by any solver.
 */
public interface ConstraintModel {
    List<Variable> variables();

    List<LinearConstraint> constraints();

    List<VariableBound> bounds();

    LinearExpr objective();

    ObjectiveSense sense();

    /**
     * @return true if the variable was created by this model
     */
    boolean owns(Variable variable);
}
