/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable linear expression without constant term. A variable may appear in several terms; the
 * coefficients are added up when the expression is read as a row.
 */
public final class LinearExpr {
    private final ImmutableList<LinearTerm> terms;

    private LinearExpr(final ImmutableList<LinearTerm> terms) {
        this.terms = terms;
    }

    public static LinearExpr term(final Variable variable, final double coefficient) {
        return new LinearExpr(ImmutableList.of(new LinearTerm(variable, coefficient)));
    }

    public static LinearExpr sum(final Variable... variables) {
        final Builder builder = builder();
        for (final Variable v : variables) {
            builder.add(v, 1.0);
        }
        return builder.build();
    }

    public static LinearExpr weightedSum(final Variable[] variables, final double[] coefficients) {
        Preconditions.checkArgument(variables.length == coefficients.length,
                                    "Got %s variables but %s coefficients", variables.length, coefficients.length);
        final Builder builder = builder();
        for (int i = 0; i < variables.length; i++) {
            builder.add(variables[i], coefficients[i]);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<LinearTerm> terms() {
        return terms;
    }

    @Override
    public String toString() {
        return terms.stream().map(LinearTerm::toString).collect(Collectors.joining(" + "));
    }

    public static final class Builder {
        private final ImmutableList.Builder<LinearTerm> terms = ImmutableList.builder();

        private Builder() {
        }

        @CanIgnoreReturnValue
        public Builder add(final Variable variable, final double coefficient) {
            terms.add(new LinearTerm(variable, coefficient));
            return this;
        }

        @CanIgnoreReturnValue
        public Builder add(final Variable variable) {
            return add(variable, 1.0);
        }

        public LinearExpr build() {
            return new LinearExpr(terms.build());
        }
    }
}
