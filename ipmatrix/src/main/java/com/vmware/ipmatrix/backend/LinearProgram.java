/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.backend;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.ipmatrix.model.LinearConstraint.Direction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable program over n columns:
 *
 * <pre>
 * minimize   objective * x
 * subject to row_i * x (<=, >=, ==) rhs_i
 *            x_j >= 0 for every j with nonnegative[j]
 * </pre>
 *
 * All constraint data is integral. Upper bounds on variables are not part of the program: instances carry
 * them as explicit rows after normalization. Whether x is integral is decided by the oracle method that
 * receives the program.
 */
public final class LinearProgram {
    private final String name;
    private final int columns;
    private final long[][] rows;
    private final long[] rhs;
    private final Direction[] directions;
    private final double[] objective;
    private final boolean[] nonnegative;

    private LinearProgram(final String name, final int columns, final long[][] rows, final long[] rhs,
                          final Direction[] directions, final double[] objective, final boolean[] nonnegative) {
        this.name = name;
        this.columns = columns;
        this.rows = rows;
        this.rhs = rhs;
        this.directions = directions;
        this.objective = objective;
        this.nonnegative = nonnegative;
    }

    /**
     * min objective * x s.t. A x = b, x >= 0 on the nonnegative mask.
     */
    public static LinearProgram equalities(final String name, final long[][] a, final long[] b,
                                           final double[] objective, final boolean[] nonnegative) {
        final Builder builder = builder(name, nonnegative.length)
                .setObjective(objective)
                .setNonnegative(nonnegative);
        Preconditions.checkArgument(a.length == b.length, "Got %s rows but %s right-hand sides", a.length, b.length);
        for (int i = 0; i < a.length; i++) {
            builder.addRow(a[i], Direction.EQUAL, b[i]);
        }
        return builder.build();
    }

    public static Builder builder(final String name, final int columns) {
        return new Builder(name, columns);
    }

    /**
     * Same constraints, different objective.
     */
    public LinearProgram withObjective(final double[] newObjective) {
        Preconditions.checkArgument(newObjective.length == columns, "Objective has length %s, expected %s",
                                    newObjective.length, columns);
        return new LinearProgram(name, columns, rows, rhs, directions, newObjective.clone(), nonnegative);
    }

    public String name() {
        return name;
    }

    public int columns() {
        return columns;
    }

    public int rowCount() {
        return rows.length;
    }

    public long[] row(final int i) {
        return rows[i].clone();
    }

    public long rhs(final int i) {
        return rhs[i];
    }

    public Direction direction(final int i) {
        return directions[i];
    }

    public double[] objective() {
        return objective.clone();
    }

    public double objective(final int j) {
        return objective[j];
    }

    public boolean isNonnegative(final int j) {
        return nonnegative[j];
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(name).append(": min ").append(Arrays.toString(objective)).append('\n');
        for (int i = 0; i < rows.length; i++) {
            sb.append(Arrays.toString(rows[i])).append(' ').append(directions[i].symbol()).append(' ')
              .append(rhs[i]).append('\n');
        }
        sb.append("nonnegative: ").append(Arrays.toString(nonnegative));
        return sb.toString();
    }

    public static final class Builder {
        private final String name;
        private final int columns;
        private final List<long[]> rows = new ArrayList<>();
        private final List<Long> rhs = new ArrayList<>();
        private final List<Direction> directions = new ArrayList<>();
        private double[] objective;
        private boolean[] nonnegative;

        private Builder(final String name, final int columns) {
            this.name = name;
            this.columns = columns;
            this.objective = new double[columns];
            this.nonnegative = new boolean[columns];
        }

        /**
         * Objective to minimize. Defaults to the zero objective.
         */
        @CanIgnoreReturnValue
        public Builder setObjective(final double[] objective) {
            Preconditions.checkArgument(objective.length == columns, "Objective has length %s, expected %s",
                                        objective.length, columns);
            this.objective = objective.clone();
            return this;
        }

        /**
         * Columns restricted to be nonnegative. Defaults to none, i.e. every column is free.
         */
        @CanIgnoreReturnValue
        public Builder setNonnegative(final boolean[] nonnegative) {
            Preconditions.checkArgument(nonnegative.length == columns, "Mask has length %s, expected %s",
                                        nonnegative.length, columns);
            this.nonnegative = nonnegative.clone();
            return this;
        }

        @CanIgnoreReturnValue
        public Builder addRow(final long[] row, final Direction direction, final long rhs) {
            Preconditions.checkArgument(row.length == columns, "Row has length %s, expected %s",
                                        row.length, columns);
            this.rows.add(row.clone());
            this.directions.add(direction);
            this.rhs.add(rhs);
            return this;
        }

        public LinearProgram build() {
            return new LinearProgram(name, columns, rows.toArray(new long[0][]),
                                     rhs.stream().mapToLong(Long::longValue).toArray(),
                                     directions.toArray(new Direction[0]), objective, nonnegative);
        }
    }
}
