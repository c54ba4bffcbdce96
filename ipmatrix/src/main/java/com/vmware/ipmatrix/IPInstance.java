/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.ipmatrix.backend.IntegerResult;
import com.vmware.ipmatrix.backend.LinearProgram;
import com.vmware.ipmatrix.backend.LpModels;
import com.vmware.ipmatrix.backend.LpOracle;
import com.vmware.ipmatrix.backend.OracleHandle;
import com.vmware.ipmatrix.backend.RelaxationResult;
import com.vmware.ipmatrix.lattice.Lattice;
import com.vmware.ipmatrix.linalg.IntegerMatrices;
import com.vmware.ipmatrix.model.ConstraintModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An integer program in canonical form
 *
 * <pre>
 * min C[0] x  s.t.  A x = b,  0 <= x_j for j < nonnegativeEnd,  x_j <= u_j where u_j is set,  x integral
 * </pre>
 *
 * with the variables ordered as [bounded | nonnegative and unbounded | unrestricted], together with an
 * integer basis of ker(A) and one integer point of the fiber {A x = b}.
 *
 * Instances are immutable and always feasible: A has full row rank, its linear relaxation has a point, and
 * A x = b has an integer solution. They are created with {@link Builder} or {@link #fromModel}; relaxations
 * and projections are derived with {@link com.vmware.ipmatrix.relaxation.Relaxations}. Every instance owns
 * its {@link OracleHandle}, so derived instances never share solver state.
 */
public final class IPInstance {
    private static final Logger LOG = LoggerFactory.getLogger(IPInstance.class);
    private static final long MAX_DENOMINATOR = 10_000;

    private final ProblemData data;
    private final VariablePermutation permutation;
    private final boolean[] binaries;
    private final int originalConstraints;
    private final int originalVariables;
    private final long[][] latticeBasis;
    private final int rank;
    private final long[] fiberSolution;
    private final boolean[] originallyBounded;
    private final BoundednessTest boundednessTest;
    private final OracleHandle handle;

    private IPInstance(final ProblemData data, final VariablePermutation permutation, final boolean[] binaries,
                       final int originalConstraints, final int originalVariables, final long[][] latticeBasis,
                       final int rank, final long[] fiberSolution, final boolean[] originallyBounded,
                       final BoundednessTest boundednessTest, final OracleHandle handle) {
        this.data = data;
        this.permutation = permutation;
        this.binaries = binaries;
        this.originalConstraints = originalConstraints;
        this.originalVariables = originalVariables;
        this.latticeBasis = latticeBasis;
        this.rank = rank;
        this.fiberSolution = fiberSolution;
        this.originallyBounded = originallyBounded;
        this.boundednessTest = boundednessTest;
        this.handle = handle;
    }

    public static Builder builder(final long[][] a, final long[] b, final double[][] c, final Long[] u) {
        return new Builder(a, b, c, u);
    }

    /**
     * A builder preloaded with data, including its nonnegativity mask.
     */
    public static Builder builder(final ProblemData data) {
        return new Builder(data.a(), data.b(), data.c(), data.u()).setNonnegative(data.nonnegative());
    }

    /**
     * Extracts a model and builds its instance. The extracted data is already in equality form, so it is
     * not normalized again.
     *
     * @throws MalformedModelException if the model cannot be expressed in integer matrix form
     * @throws InfeasibleRelaxationException if the model has no feasible point
     */
    public static IPInstance fromModel(final ConstraintModel model, final LpOracle oracle,
                                       final boolean inferBinary) {
        final ProblemData extracted = new ModelExtractor(inferBinary).extract(model);
        return builder(extracted).setApplyNormalization(false).build(oracle);
    }

    public static IPInstance fromModel(final ConstraintModel model, final LpOracle oracle) {
        return fromModel(model, oracle, true);
    }

    /**
     * The same instance with another objective. Constraints, permutation and lattice data are kept as they
     * are; the copy gets a fresh oracle handle.
     */
    public IPInstance withObjective(final double[] objective) {
        Preconditions.checkArgument(objective.length == n(), "Objective has length %s, expected %s",
                                    objective.length, n());
        final double[][] c = data.c();
        c[0] = objective.clone();
        final ProblemData newData = data.withObjective(c);
        return new IPInstance(newData, permutation, binaries, originalConstraints, originalVariables,
                              latticeBasis, rank, fiberSolution, originallyBounded, boundednessTest,
                              handle.derive(relaxationOf(newData)));
    }

    public ProblemData data() {
        return data;
    }

    public long[][] a() {
        return data.a();
    }

    public long[] b() {
        return data.b();
    }

    public double[][] c() {
        return data.c();
    }

    /**
     * The objective row that is minimized, C[0].
     */
    public double[] objective() {
        return data.objective();
    }

    /**
     * Upper bounds per variable; null where a variable has none.
     */
    public Long[] u() {
        return data.u();
    }

    public int m() {
        return data.m();
    }

    public int n() {
        return data.n();
    }

    /**
     * Always true: maximization inputs are negated on the way in.
     */
    public boolean isMinimization() {
        return true;
    }

    public int boundedEnd() {
        return permutation.boundedEnd();
    }

    public int nonnegativeEnd() {
        return permutation.nonnegativeEnd();
    }

    /**
     * permutation()[k] is the index, before permutation, of the variable at position k.
     */
    public int[] permutation() {
        return permutation.permutation();
    }

    public int[] inversePermutation() {
        return permutation.inverse();
    }

    public VariablePermutation variablePermutation() {
        return permutation;
    }

    /**
     * Variables with upper bound 1, in the permuted order.
     */
    public boolean[] binaries() {
        return binaries.clone();
    }

    /**
     * Number of linearly independent constraints before normalization.
     */
    public int originalConstraints() {
        return originalConstraints;
    }

    /**
     * Number of variables before normalization.
     */
    public int originalVariables() {
        return originalVariables;
    }

    /**
     * Row basis of ker(A), n - rank rows.
     */
    public long[][] latticeBasis() {
        return IntegerMatrices.copy(latticeBasis);
    }

    public int rank() {
        return rank;
    }

    public long[] fiberSolution() {
        return fiberSolution.clone();
    }

    /**
     * Boundedness of each variable before the permutation was applied.
     */
    public boolean[] originallyBounded() {
        return originallyBounded.clone();
    }

    public BoundednessTest boundednessTest() {
        return boundednessTest;
    }

    public LpOracle oracle() {
        return handle.oracle();
    }

    /**
     * The solver handle owned by this instance.
     */
    public OracleHandle oracleHandle() {
        return handle;
    }

    public boolean isNonnegative(final int i) {
        Preconditions.checkElementIndex(i, n());
        return i < nonnegativeEnd();
    }

    public boolean isBounded(final int i) {
        Preconditions.checkElementIndex(i, n());
        return i < boundedEnd();
    }

    public boolean[] nonnegativeVariables() {
        final boolean[] out = new boolean[n()];
        for (int i = 0; i < nonnegativeEnd(); i++) {
            out[i] = true;
        }
        return out;
    }

    /**
     * Nonnegative variables that are not bounded.
     */
    public boolean[] unboundedVariables() {
        final boolean[] out = new boolean[n()];
        for (int i = boundedEnd(); i < nonnegativeEnd(); i++) {
            out[i] = true;
        }
        return out;
    }

    /**
     * True iff the linear relaxation has a finite optimum for the current objective.
     */
    public boolean isBounded() {
        return handle.isBounded();
    }

    /**
     * Optimal value of the linear relaxation.
     *
     * @throws IllegalStateException if the relaxation is unbounded
     */
    public double linearRelaxation() {
        final RelaxationResult result = handle.solve();
        Preconditions.checkState(result.isOptimal(), "The linear relaxation has no optimum: %s", result.status());
        return result.objectiveValue();
    }

    /**
     * Columns in an optimal basis of the linear relaxation.
     */
    public boolean[] optimalBasis() {
        return handle.optimalBasis();
    }

    /**
     * Solves the integer program min C[0] x s.t. A x = b, x >= 0 on the nonnegative variables. Upper bounds
     * are only enforced where A carries them as rows.
     *
     * @return the oracle's answer, with the solution in this instance's variable order
     */
    public IntegerResult solve() {
        return handle.solveInteger();
    }

    /**
     * C scaled by the least common multiple of the denominators of its entries, so that every entry is
     * an integer. Denominators are recovered up to {@value #MAX_DENOMINATOR}.
     *
     * @throws ArithmeticException if an entry has no rational form with such a denominator, or the
     *         scaled matrix does not fit in longs
     */
    public long[][] integerObjective() {
        final double[][] c = data.c();
        long scale = 1;
        for (final double[] row : c) {
            for (final double x : row) {
                final long d = denominator(x);
                scale = LongMath.checkedMultiply(scale / LongMath.gcd(scale, d), d);
            }
        }
        final long[][] out = new long[c.length][];
        for (int r = 0; r < c.length; r++) {
            out[r] = new long[c[r].length];
            for (int j = 0; j < c[r].length; j++) {
                out[r][j] = Math.round(scale * c[r][j]);
            }
        }
        return out;
    }

    private static long denominator(final double x) {
        for (long d = 1; d <= MAX_DENOMINATOR; d++) {
            final double scaled = d * x;
            if (Numerics.approxEqual(scaled, Math.rint(scaled))) {
                return d;
            }
        }
        throw new ArithmeticException("No rational form with a small denominator for " + x);
    }

    /**
     * True iff the last n - m rows of A, restricted to the first n - m columns, form an identity. This is the
     * layout normalization produces when every variable has an upper bound.
     */
    public boolean hasVariableBoundConstraints() {
        final long[][] a = data.a();
        final int structural = n() - m();
        final int firstBoundRow = m() - structural;
        if (structural <= 0 || firstBoundRow < 0) {
            return false;
        }
        for (int i = firstBoundRow; i < m(); i++) {
            for (int j = 0; j < structural; j++) {
                final long expected = i - firstBoundRow == j ? 1 : 0;
                if (a[i][j] != expected) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Looks for an integer u with A u = 0, u >= 0 on the nonnegative variables and u_i >= 1.
     *
     * @return such a u, or empty if the oracle proves there is none
     */
    public Optional<long[]> unboundednessProof(final int i) {
        final IntegerResult result = oracle().solveInteger(
                LpModels.integerRayProgram(data.a(), nonnegativeVariables(), i));
        return result.isOptimal() ? Optional.of(result.solution()) : Optional.empty();
    }

    public boolean inKernel(final long[] v) {
        return Lattice.inKernel(data.a(), v);
    }

    public boolean inKernel(final List<long[]> vectors) {
        final long[][] a = data.a();
        for (final long[] v : vectors) {
            if (!Lattice.inKernel(a, v)) {
                return false;
            }
        }
        return true;
    }

    public boolean isFeasibleSolution(final long[] solution) {
        Preconditions.checkArgument(solution.length == n(), "Solution has length %s, expected %s",
                                    solution.length, n());
        if (!Arrays.equals(IntegerMatrices.multiply(data.a(), solution), data.b())) {
            return false;
        }
        for (int i = 0; i < nonnegativeEnd(); i++) {
            if (solution[i] < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks solution after reordering it as solution[order[0]], ..., solution[order[n - 1]].
     */
    public boolean isFeasibleSolution(final long[] solution, final int[] order) {
        return isFeasibleSolution(VariablePermutation.apply(solution, order));
    }

    /**
     * Completes a solution given for the first partial.length variables with integer values for the rest,
     * so that A x = b holds. Sign constraints of the completed part are not enforced.
     *
     * @return the full solution, or empty if no integer completion exists
     */
    public Optional<long[]> extendFeasibleSolution(final long[] partial) {
        Preconditions.checkArgument(partial.length <= n(), "Partial solution of length %s for %s variables",
                                    partial.length, n());
        final int p = partial.length;
        final long[][] a = data.a();
        final long[] remainingB = data.b();
        final long[][] remainingA = new long[a.length][n() - p];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < p; j++) {
                remainingB[i] = Math.subtractExact(remainingB[i], Math.multiplyExact(a[i][j], partial[j]));
            }
            System.arraycopy(a[i], p, remainingA[i], 0, n() - p);
        }
        return Lattice.of(remainingA, n() - p).solve(remainingB).map(rest -> {
            final long[] full = Arrays.copyOf(partial, n());
            System.arraycopy(rest, 0, full, p, rest.length);
            return full;
        });
    }

    /**
     * The original constraint block of A, with columns back in their original order.
     */
    public long[][] originalMatrix() {
        final long[][] a = data.a();
        final int[] inverse = permutation.inverse();
        final long[][] out = new long[originalConstraints][originalVariables];
        for (int i = 0; i < originalConstraints; i++) {
            for (int j = 0; j < originalVariables; j++) {
                out[i][j] = a[i][inverse[j]];
            }
        }
        return out;
    }

    public long[] originalRhs() {
        return Arrays.copyOf(data.b(), originalConstraints);
    }

    public Long[] originalUpperBounds() {
        final Long[] u = data.u();
        final int[] inverse = permutation.inverse();
        final Long[] out = new Long[originalVariables];
        for (int j = 0; j < originalVariables; j++) {
            out[j] = u[inverse[j]];
        }
        return out;
    }

    public double[][] originalObjective() {
        final double[][] c = data.c();
        final int[] inverse = permutation.inverse();
        final double[][] out = new double[c.length][originalVariables];
        for (int r = 0; r < c.length; r++) {
            for (int j = 0; j < originalVariables; j++) {
                out[r][j] = c[r][inverse[j]];
            }
        }
        return out;
    }

    /**
     * True iff every row of A has a slack column: a column with a 1 in that row and 0 everywhere else.
     */
    public boolean hasSlacks() {
        final long[][] a = data.a();
        for (int i = 0; i < a.length; i++) {
            boolean found = false;
            for (int j = 0; j < n() && !found; j++) {
                found = a[i][j] == 1 && isUnitColumn(a, i, j);
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static boolean isUnitColumn(final long[][] a, final int row, final int column) {
        for (int k = 0; k < a.length; k++) {
            if (k != row && a[k][column] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * True iff all variables are nonnegative and A and b have no negative entry.
     */
    public boolean nonnegativeDataOnly() {
        if (nonnegativeEnd() != n()) {
            return false;
        }
        for (final long[] row : data.a()) {
            for (final long x : row) {
                if (x < 0) {
                    return false;
                }
            }
        }
        for (final long x : data.b()) {
            if (x < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Maps vectors given in this instance's variable order back to the order before permutation.
     */
    public List<long[]> originalVariableOrder(final List<long[]> vectors) {
        return permutation.applyInverse(vectors);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("min ").append(Arrays.toString(data.objective())).append('\n');
        final long[][] a = data.a();
        final long[] b = data.b();
        for (int i = 0; i < a.length; i++) {
            sb.append(Arrays.toString(a[i])).append(" = ").append(b[i]).append('\n');
        }
        final List<String> bounds = new ArrayList<>();
        final Long[] u = data.u();
        for (int j = 0; j < u.length; j++) {
            if (u[j] != null) {
                bounds.add("0 <= x" + j + " <= " + u[j]);
            }
        }
        sb.append(String.join("\n", bounds));
        return sb.toString();
    }

    private static LinearProgram relaxationOf(final ProblemData data) {
        return LpModels.relaxation(data.a(), data.b(), data.objective(), data.nonnegative());
    }

    /**
     * Two-phase construction: {@link #validate()} checks and normalizes the raw data without touching a
     * solver, {@link #build(LpOracle)} classifies variables, permutes them and computes the lattice data.
     */
    public static class Builder {
        private final long[][] a;
        private final long[] b;
        private final double[][] c;
        private final Long[] u;
        @Nullable private boolean[] nonnegative = null;
        private boolean applyNormalization = true;
        private boolean invertObjective = true;
        private BoundednessTest boundednessTest = BoundednessTest.LINEAR_RELAXATION;

        private Builder(final long[][] a, final long[] b, final double[][] c, final Long[] u) {
            this.a = a;
            this.b = b;
            this.c = c;
            this.u = u;
        }

        /**
         * Variables restricted to be nonnegative.
         * @param nonnegative one flag per variable. Defaults to all variables nonnegative.
         * @return the current Builder object with `nonnegative` set
         */
        @CanIgnoreReturnValue
        public Builder setNonnegative(final boolean[] nonnegative) {
            this.nonnegative = nonnegative.clone();
            return this;
        }

        /**
         * Configures whether slack columns and upper bound rows are added to bring the data into equality
         * form. Data that is already in that form, such as the data of another instance, must not be
         * normalized again.
         * @param applyNormalization true to normalize. Defaults to true.
         * @return the current Builder object with `applyNormalization` set
         */
        @CanIgnoreReturnValue
        public Builder setApplyNormalization(final boolean applyNormalization) {
            this.applyNormalization = applyNormalization;
            return this;
        }

        /**
         * Configures whether the objective is negated during normalization, for inputs stated as
         * maximization problems.
         * @param invertObjective true to negate C. Defaults to true.
         * @return the current Builder object with `invertObjective` set
         */
        @CanIgnoreReturnValue
        public Builder setInvertObjective(final boolean invertObjective) {
            this.invertObjective = invertObjective;
            return this;
        }

        /**
         * Oracle query used to decide variable boundedness.
         * @param boundednessTest the query. Defaults to LINEAR_RELAXATION.
         * @return the current Builder object with `boundednessTest` set
         */
        @CanIgnoreReturnValue
        public Builder setBoundednessTest(final BoundednessTest boundednessTest) {
            this.boundednessTest = boundednessTest;
            return this;
        }

        /**
         * First phase: dimension checks, full row rank and normalization. Needs no solver.
         *
         * @throws IllegalArgumentException if the dimensions of the data do not agree
         * @throws InfeasibleRelaxationException if A x = b is inconsistent
         */
        public ProblemData validate() {
            return normalize(independentRows());
        }

        private ProblemData independentRows() {
            final boolean[] mask;
            if (nonnegative == null) {
                mask = new boolean[u.length];
                Arrays.fill(mask, true);
            } else {
                mask = nonnegative;
            }
            Preconditions.checkArgument(a.length == b.length, "A has %s rows but b has length %s",
                                        a.length, b.length);
            Preconditions.checkArgument(mask.length == u.length, "Got %s nonnegativity flags for %s variables",
                                        mask.length, u.length);
            return Normalizer.independentRows(new ProblemData(a, b, c, u, mask));
        }

        private ProblemData normalize(final ProblemData independent) {
            return applyNormalization ? Normalizer.standardForm(independent, invertObjective) : independent;
        }

        /**
         * Second phase: classification, permutation and lattice data.
         *
         * @throws InfeasibleRelaxationException if the relaxation or the integer fiber is empty
         * @throws SolverException if the oracle fails
         */
        public IPInstance build(final LpOracle oracle) {
            final ProblemData independent = independentRows();
            final ProblemData normalized = normalize(independent);
            final int n = normalized.n();

            final boolean[] bounded = new VariableClassifier(oracle, boundednessTest)
                    .bounded(normalized.a(), normalized.nonnegative());
            final VariablePermutation permutation = VariablePermutation.compute(bounded, normalized.nonnegative());
            final ProblemData permuted = normalized.permute(permutation);

            final OracleHandle handle = new OracleHandle(oracle, relaxationOf(permuted));
            if (!handle.isFeasible()) {
                throw new InfeasibleRelaxationException("The linear relaxation is infeasible");
            }

            final long[][] a = permuted.a();
            final long[] rhs = permuted.b();
            final Lattice lattice = Lattice.of(a, n);
            if (lattice.rank() < a.length) {
                LOG.warn("A has rank {} but {} rows; using {} as the lattice dimension", lattice.rank(),
                         a.length, lattice.dimension());
            }
            final long[][] basis = lattice.basis();
            final long[] fiber = lattice.fiberSolution(rhs);
            Preconditions.checkState(Arrays.equals(IntegerMatrices.multiply(a, fiber), rhs),
                                     "Fiber solution does not satisfy A x = b");
            for (final long[] row : basis) {
                Preconditions.checkState(Lattice.inKernel(a, row), "Lattice basis row %s is not in ker(A)",
                                         Arrays.toString(row));
            }

            final Long[] permutedU = permuted.u();
            final boolean[] binaries = new boolean[n];
            for (int j = 0; j < n; j++) {
                binaries[j] = permutedU[j] != null && permutedU[j] == 1L;
            }
            LOG.info("Built instance with {} rows and {} variables ({} bounded, {} nonnegative), "
                             + "lattice of dimension {}", permuted.m(), n, permutation.boundedEnd(),
                     permutation.nonnegativeEnd(), basis.length);
            return new IPInstance(permuted, permutation, binaries, independent.m(), independent.n(), basis,
                                  lattice.rank(), fiber, bounded, boundednessTest, handle);
        }
    }
}
