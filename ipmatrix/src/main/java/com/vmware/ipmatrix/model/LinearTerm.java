/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

/**
 * coefficient * variable
 */
public final class LinearTerm {
    private final Variable variable;
    private final double coefficient;

    public LinearTerm(final Variable variable, final double coefficient) {
        this.variable = variable;
        this.coefficient = coefficient;
    }

    public Variable variable() {
        return variable;
    }

    public double coefficient() {
        return coefficient;
    }

    @Override
    public String toString() {
        return coefficient + "*" + variable;
    }
}
