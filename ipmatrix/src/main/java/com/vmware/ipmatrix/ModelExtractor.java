/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import com.vmware.ipmatrix.linalg.IntegerMatrices;
import com.vmware.ipmatrix.model.ConstraintModel;
import com.vmware.ipmatrix.model.LinearConstraint;
import com.vmware.ipmatrix.model.LinearExpr;
import com.vmware.ipmatrix.model.LinearTerm;
import com.vmware.ipmatrix.model.ObjectiveSense;
import com.vmware.ipmatrix.model.Variable;
import com.vmware.ipmatrix.model.VariableBound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a {@link ConstraintModel} into equality-form {@link ProblemData}.
 *
 * Every model constraint becomes one row, followed by one row per non-zero lower bound and one row per
 * upper bound. A {@code <=} row gets a +1 slack column and a {@code >=} row a -1 slack column; equalities get
 * none. Zero lower bounds do not produce rows: they only mark the variable nonnegative. All coefficients,
 * right-hand sides and bounds must be integral within {@link Numerics#EPSILON}.
 */
public final class ModelExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ModelExtractor.class);

    private final boolean inferBinary;

    /**
     * @param inferBinary whether binary variables get an explicit {@code x <= 1} row
     */
    public ModelExtractor(final boolean inferBinary) {
        this.inferBinary = inferBinary;
    }

    public ModelExtractor() {
        this(true);
    }

    /**
     * @throws MalformedModelException if a term refers to a foreign variable or a value is not integral
     * @throws InfeasibleRelaxationException if the model constraints are linearly dependent and inconsistent
     */
    public ProblemData extract(final ConstraintModel model) {
        final List<Variable> variables = model.variables();
        final int n = variables.size();
        for (int j = 0; j < n; j++) {
            if (variables.get(j).index() != j || !model.owns(variables.get(j))) {
                throw new MalformedModelException("Variable " + variables.get(j) + " is not owned by the model");
            }
        }
        final Long[] lower = new Long[n];
        final Long[] upper = new Long[n];
        for (final VariableBound bound : model.bounds()) {
            final int j = indexOf(model, bound.variable());
            final long value = integral(bound.value(), "bound " + bound);
            if (bound.type() == VariableBound.Type.LOWER) {
                lower[j] = lower[j] == null ? value : Math.max(lower[j], value);
            } else {
                upper[j] = upper[j] == null ? value : Math.min(upper[j], value);
            }
        }
        if (inferBinary) {
            for (final Variable v : variables) {
                if (v.isBinary()) {
                    upper[v.index()] = upper[v.index()] == null ? 1L : Math.min(upper[v.index()], 1L);
                }
            }
        }

        final List<long[]> rows = new ArrayList<>();
        final List<Long> rhs = new ArrayList<>();
        final List<LinearConstraint.Direction> directions = new ArrayList<>();
        for (final LinearConstraint constraint : model.constraints()) {
            rows.add(row(model, constraint.expression(), n, "constraint " + constraint));
            rhs.add(integral(constraint.rhs(), "right-hand side of " + constraint));
            directions.add(constraint.direction());
        }
        for (int j = 0; j < n; j++) {
            if (lower[j] != null && lower[j] != 0) {
                rows.add(unit(n, j));
                rhs.add(lower[j]);
                directions.add(LinearConstraint.Direction.GREATER_OR_EQUAL);
            }
        }
        final int originalRows = rows.size();
        for (int j = 0; j < n; j++) {
            if (upper[j] != null) {
                rows.add(unit(n, j));
                rhs.add(upper[j]);
                directions.add(LinearConstraint.Direction.LESS_OR_EQUAL);
            }
        }

        int slacks = 0;
        for (final LinearConstraint.Direction direction : directions) {
            if (direction != LinearConstraint.Direction.EQUAL) {
                slacks++;
            }
        }
        final int m = rows.size();
        final int columns = n + slacks;
        final long[][] a = new long[m][columns];
        final long[] b = new long[m];
        int slack = n;
        for (int i = 0; i < m; i++) {
            System.arraycopy(rows.get(i), 0, a[i], 0, n);
            b[i] = rhs.get(i);
            switch (directions.get(i)) {
                case LESS_OR_EQUAL:
                    a[i][slack++] = 1;
                    break;
                case GREATER_OR_EQUAL:
                    a[i][slack++] = -1;
                    break;
                default:
                    break;
            }
        }

        // Only the model and lower-bound rows can be dependent: each upper-bound row owns a slack column.
        final long[][] head = new long[originalRows][];
        System.arraycopy(a, 0, head, 0, originalRows);
        final int[] kept = IntegerMatrices.independentRows(head, columns);
        final long[][] filteredA;
        final long[] filteredB;
        if (kept.length < originalRows) {
            if (!IntegerMatrices.isConsistent(head, Arrays.copyOf(b, originalRows), columns)) {
                throw new InfeasibleRelaxationException("The model constraints are inconsistent");
            }
            LOG.debug("Dropping {} linearly dependent model constraints", originalRows - kept.length);
            final int[] allKept = new int[kept.length + m - originalRows];
            System.arraycopy(kept, 0, allKept, 0, kept.length);
            for (int i = originalRows; i < m; i++) {
                allKept[kept.length + i - originalRows] = i;
            }
            filteredA = IntegerMatrices.selectRows(a, allKept);
            filteredB = IntegerMatrices.select(b, allKept);
        } else {
            filteredA = a;
            filteredB = b;
        }

        final double[][] c = new double[1][columns];
        final double sign = model.sense() == ObjectiveSense.MAXIMIZE ? -1.0 : 1.0;
        final long[] objective = row(model, model.objective(), n, "objective");
        for (int j = 0; j < n; j++) {
            c[0][j] = sign * objective[j];
        }
        final Long[] u = new Long[columns];
        System.arraycopy(upper, 0, u, 0, n);
        final boolean[] nonnegative = new boolean[columns];
        for (int j = 0; j < columns; j++) {
            nonnegative[j] = j >= n || (lower[j] != null && lower[j] >= 0);
        }
        LOG.debug("Extracted {} rows and {} columns ({} slacks) from a model with {} constraints",
                  filteredA.length, columns, slacks, model.constraints().size());
        return new ProblemData(filteredA, filteredB, c, u, nonnegative);
    }

    private static long[] row(final ConstraintModel model, final LinearExpr expression, final int n,
                              final String what) {
        final double[] coefficients = new double[n];
        for (final LinearTerm term : expression.terms()) {
            coefficients[indexOf(model, term.variable())] += term.coefficient();
        }
        final long[] row = new long[n];
        for (int j = 0; j < n; j++) {
            row[j] = integral(coefficients[j], what);
        }
        return row;
    }

    private static int indexOf(final ConstraintModel model, final Variable variable) {
        if (!model.owns(variable)) {
            throw new MalformedModelException("Variable " + variable + " does not belong to the model");
        }
        return variable.index();
    }

    private static long integral(final double value, final String what) {
        try {
            return Numerics.toIntegral(value);
        } catch (final ArithmeticException e) {
            throw new MalformedModelException("Non-integral value " + value + " in " + what, e);
        }
    }

    private static long[] unit(final int n, final int j) {
        final long[] row = new long[n];
        row[j] = 1;
        return row;
    }
}
