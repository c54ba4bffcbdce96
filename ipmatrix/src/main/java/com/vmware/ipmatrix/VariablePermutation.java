/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A reordering of variables into three contiguous blocks:
 *
 * <ol>
 *   <li>bounded and nonnegative, indices [0, boundedEnd)</li>
 *   <li>nonnegative and unbounded, indices [boundedEnd, nonnegativeEnd)</li>
 *   <li>unrestricted in sign, indices [nonnegativeEnd, n)</li>
 * </ol>
 *
 * Within each block the original relative order is kept. {@code permutation[k]} is the original index of the
 * variable placed at position k, so applying the permutation to a vector v yields v[permutation[0]], ...,
 * v[permutation[n - 1]].
 */
public final class VariablePermutation {
    private final int[] permutation;
    private final int[] inverse;
    private final int boundedEnd;
    private final int nonnegativeEnd;

    private VariablePermutation(final int[] permutation, final int boundedEnd, final int nonnegativeEnd) {
        this.permutation = permutation;
        this.inverse = invert(permutation);
        this.boundedEnd = boundedEnd;
        this.nonnegativeEnd = nonnegativeEnd;
    }

    public static VariablePermutation compute(final boolean[] bounded, final boolean[] nonnegative) {
        Preconditions.checkArgument(bounded.length == nonnegative.length,
                                    "Got %s boundedness flags for %s variables", bounded.length, nonnegative.length);
        final int n = bounded.length;
        final int[] permutation = new int[n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (bounded[i] && nonnegative[i]) {
                permutation[k++] = i;
            }
        }
        final int boundedEnd = k;
        for (int i = 0; i < n; i++) {
            if (!bounded[i] && nonnegative[i]) {
                permutation[k++] = i;
            }
        }
        final int nonnegativeEnd = k;
        for (int i = 0; i < n; i++) {
            if (!nonnegative[i]) {
                permutation[k++] = i;
            }
        }
        Preconditions.checkState(k == n, "Permutation covers %s of %s variables", k, n);
        return new VariablePermutation(permutation, boundedEnd, nonnegativeEnd);
    }

    public static VariablePermutation identity(final int n, final int boundedEnd, final int nonnegativeEnd) {
        Preconditions.checkArgument(0 <= boundedEnd && boundedEnd <= nonnegativeEnd && nonnegativeEnd <= n);
        final int[] permutation = new int[n];
        for (int i = 0; i < n; i++) {
            permutation[i] = i;
        }
        return new VariablePermutation(permutation, boundedEnd, nonnegativeEnd);
    }

    private static int[] invert(final int[] permutation) {
        final int[] inverse = new int[permutation.length];
        Arrays.fill(inverse, -1);
        for (int k = 0; k < permutation.length; k++) {
            final int i = permutation[k];
            Preconditions.checkState(i >= 0 && i < permutation.length && inverse[i] == -1,
                                     "Not a permutation: %s", Arrays.toString(permutation));
            inverse[i] = k;
        }
        return inverse;
    }

    public int size() {
        return permutation.length;
    }

    public int[] permutation() {
        return permutation.clone();
    }

    public int[] inverse() {
        return inverse.clone();
    }

    public int boundedEnd() {
        return boundedEnd;
    }

    public int nonnegativeEnd() {
        return nonnegativeEnd;
    }

    public boolean isIdentity() {
        for (int k = 0; k < permutation.length; k++) {
            if (permutation[k] != k) {
                return false;
            }
        }
        return true;
    }

    public long[] apply(final long[] v) {
        return apply(v, permutation);
    }

    public long[] applyInverse(final long[] v) {
        return apply(v, inverse);
    }

    public double[] apply(final double[] v) {
        checkLength(v.length);
        final double[] out = new double[v.length];
        for (int k = 0; k < v.length; k++) {
            out[k] = v[permutation[k]];
        }
        return out;
    }

    public boolean[] apply(final boolean[] v) {
        checkLength(v.length);
        final boolean[] out = new boolean[v.length];
        for (int k = 0; k < v.length; k++) {
            out[k] = v[permutation[k]];
        }
        return out;
    }

    public Long[] apply(final Long[] v) {
        checkLength(v.length);
        final Long[] out = new Long[v.length];
        for (int k = 0; k < v.length; k++) {
            out[k] = v[permutation[k]];
        }
        return out;
    }

    /**
     * Applies the permutation to every vector of a set.
     */
    public List<long[]> apply(final List<long[]> vectors) {
        final List<long[]> out = new ArrayList<>(vectors.size());
        for (final long[] v : vectors) {
            out.add(apply(v));
        }
        return out;
    }

    /**
     * Undoes the permutation on every vector of a set, returning to the original variable order.
     */
    public List<long[]> applyInverse(final List<long[]> vectors) {
        final List<long[]> out = new ArrayList<>(vectors.size());
        for (final long[] v : vectors) {
            out.add(applyInverse(v));
        }
        return out;
    }

    /**
     * out[k] = v[order[k]]
     */
    public static long[] apply(final long[] v, final int[] order) {
        Preconditions.checkArgument(v.length == order.length, "Vector of length %s, permutation of size %s",
                                    v.length, order.length);
        final long[] out = new long[v.length];
        for (int k = 0; k < v.length; k++) {
            out[k] = v[order[k]];
        }
        return out;
    }

    private void checkLength(final int length) {
        Preconditions.checkArgument(length == permutation.length, "Vector of length %s, permutation of size %s",
                                    length, permutation.length);
    }

    @Override
    public String toString() {
        return "VariablePermutation{" + Arrays.toString(permutation) + ", boundedEnd=" + boundedEnd
                + ", nonnegativeEnd=" + nonnegativeEnd + "}";
    }
}
