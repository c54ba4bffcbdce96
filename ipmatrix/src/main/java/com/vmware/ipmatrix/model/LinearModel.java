/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.ArrayList;
import java.util.List;

/**
 * A mutable, in-memory {@link ConstraintModel}. The method names follow the OR-Tools CP-SAT modeling API so
 * that models read the same way regardless of the solver that eventually sees them.
 *
 * <pre>{@code
 * final LinearModel model = new LinearModel();
 * final Variable x = model.newIntVar(0, 5, "x");
 * final Variable y = model.newBoolVar("y");
 * model.addLessOrEqual(LinearExpr.sum(x, y), 4);
 * model.maximize(LinearExpr.term(x, 2));
 * }</pre>
 */
public class LinearModel implements ConstraintModel {
    private final List<Variable> variables = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private final List<VariableBound> bounds = new ArrayList<>();
    private LinearExpr objective = LinearExpr.builder().build();
    private ObjectiveSense sense = ObjectiveSense.MINIMIZE;

    /**
     * A free variable of the given kind.
     */
    public Variable newVar(final String name, final VariableKind kind) {
        final Variable v = new Variable(this, variables.size(), name, kind, false);
        variables.add(v);
        return v;
    }

    /**
     * An integer variable with lb <= x <= ub.
     */
    public Variable newIntVar(final long lb, final long ub, final String name) {
        Preconditions.checkArgument(lb <= ub, "Empty domain [%s, %s] for %s", lb, ub, name);
        final Variable v = newVar(name, VariableKind.INTEGER);
        setLowerBound(v, lb);
        setUpperBound(v, ub);
        return v;
    }

    /**
     * An integer 0/1 variable. Its upper bound is implied by the binary marker.
     */
    public Variable newBoolVar(final String name) {
        final Variable v = new Variable(this, variables.size(), name, VariableKind.INTEGER, true);
        variables.add(v);
        setLowerBound(v, 0);
        return v;
    }

    @CanIgnoreReturnValue
    public VariableBound setLowerBound(final Variable v, final double lb) {
        return addBound(new VariableBound(v, VariableBound.Type.LOWER, lb));
    }

    @CanIgnoreReturnValue
    public VariableBound setUpperBound(final Variable v, final double ub) {
        return addBound(new VariableBound(v, VariableBound.Type.UPPER, ub));
    }

    @CanIgnoreReturnValue
    public LinearConstraint addLessOrEqual(final LinearExpr expr, final double rhs) {
        return addConstraint(new LinearConstraint(expr, LinearConstraint.Direction.LESS_OR_EQUAL, rhs));
    }

    @CanIgnoreReturnValue
    public LinearConstraint addGreaterOrEqual(final LinearExpr expr, final double rhs) {
        return addConstraint(new LinearConstraint(expr, LinearConstraint.Direction.GREATER_OR_EQUAL, rhs));
    }

    @CanIgnoreReturnValue
    public LinearConstraint addEquality(final LinearExpr expr, final double rhs) {
        return addConstraint(new LinearConstraint(expr, LinearConstraint.Direction.EQUAL, rhs));
    }

    @CanIgnoreReturnValue
    public LinearConstraint addConstraint(final LinearConstraint constraint) {
        constraints.add(constraint);
        return constraint;
    }

    public void minimize(final LinearExpr expr) {
        this.objective = expr;
        this.sense = ObjectiveSense.MINIMIZE;
    }

    public void maximize(final LinearExpr expr) {
        this.objective = expr;
        this.sense = ObjectiveSense.MAXIMIZE;
    }

    private VariableBound addBound(final VariableBound bound) {
        bounds.add(bound);
        return bound;
    }

    @Override
    public List<Variable> variables() {
        return ImmutableList.copyOf(variables);
    }

    @Override
    public List<LinearConstraint> constraints() {
        return ImmutableList.copyOf(constraints);
    }

    @Override
    public List<VariableBound> bounds() {
        return ImmutableList.copyOf(bounds);
    }

    @Override
    public LinearExpr objective() {
        return objective;
    }

    @Override
    public ObjectiveSense sense() {
        return sense;
    }

    @Override
    public boolean owns(final Variable variable) {
        return variable.belongsTo(this);
    }
}
