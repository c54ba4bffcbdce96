/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

/**
 * expression (<=, >=, ==) rhs
 */
public final class LinearConstraint {
    private final LinearExpr expression;
    private final Direction direction;
    private final double rhs;

    public LinearConstraint(final LinearExpr expression, final Direction direction, final double rhs) {
        this.expression = expression;
        this.direction = direction;
        this.rhs = rhs;
    }

    public LinearExpr expression() {
        return expression;
    }

    public Direction direction() {
        return direction;
    }

    public double rhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return expression + " " + direction.symbol() + " " + rhs;
    }

    public enum Direction {
        LESS_OR_EQUAL("<="),
        GREATER_OR_EQUAL(">="),
        EQUAL("==");

        private final String symbol;

        Direction(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
