/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

/**
 * A single-variable bound, kept apart from the general constraints so that zero lower bounds can be turned
 * into nonnegativity flags instead of rows.
 */
public final class VariableBound {
    private final Variable variable;
    private final Type type;
    private final double value;

    public VariableBound(final Variable variable, final Type type, final double value) {
        this.variable = variable;
        this.type = type;
        this.value = value;
    }

    public Variable variable() {
        return variable;
    }

    public Type type() {
        return type;
    }

    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return variable + (type == Type.LOWER ? " >= " : " <= ") + value;
    }

    public enum Type {
        LOWER,
        UPPER
    }
}
