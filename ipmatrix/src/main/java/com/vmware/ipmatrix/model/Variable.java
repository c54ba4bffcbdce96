/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

import java.util.Objects;

/**
 * A decision variable owned by a {@link LinearModel}. Variables are identified by their owner and their
 * position in it.
 */
public final class Variable {
    private final LinearModel owner;
    private final int index;
    private final String name;
    private final VariableKind kind;
    private final boolean binary;

    Variable(final LinearModel owner, final int index, final String name, final VariableKind kind,
             final boolean binary) {
        this.owner = owner;
        this.index = index;
        this.name = name;
        this.kind = kind;
        this.binary = binary;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public VariableKind kind() {
        return kind;
    }

    /**
     * True if the variable was declared as a 0/1 variable. Only the lower bound is recorded as a bound;
     * the upper bound of 1 is implied by this marker.
     */
    public boolean isBinary() {
        return binary;
    }

    boolean belongsTo(final LinearModel model) {
        return owner == model;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        final Variable that = (Variable) o;
        return owner == that.owner && index == that.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(owner), index);
    }

    @Override
    public String toString() {
        return name;
    }
}
