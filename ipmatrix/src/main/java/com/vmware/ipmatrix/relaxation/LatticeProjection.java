/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import com.vmware.ipmatrix.linalg.IntegerMatrices;

import java.util.Arrays;

/**
 * A lattice basis restricted to a maximal set of linearly independent columns.
 */
public final class LatticeProjection {
    private final long[][] normalizedBasis;
    private final long[][] selectedColumns;
    private final int[] columns;
    private final int[] sigma;

    LatticeProjection(final long[][] normalizedBasis, final long[][] selectedColumns, final int[] columns,
                      final int[] sigma) {
        this.normalizedBasis = normalizedBasis;
        this.selectedColumns = selectedColumns;
        this.columns = columns;
        this.sigma = sigma;
    }

    /**
     * The normalized HNF of {@link #selectedColumns()}; generates the same projected lattice.
     */
    public long[][] normalizedBasis() {
        return IntegerMatrices.copy(normalizedBasis);
    }

    /**
     * The lattice basis restricted to {@link #columns()}, row for row.
     */
    public long[][] selectedColumns() {
        return IntegerMatrices.copy(selectedColumns);
    }

    /**
     * Indices of the kept variables, increasing.
     */
    public int[] columns() {
        return columns.clone();
    }

    /**
     * Indices of the variables that were projected away, increasing.
     */
    public int[] sigma() {
        return sigma.clone();
    }

    @Override
    public String toString() {
        return "LatticeProjection{columns=" + Arrays.toString(columns) + ", sigma=" + Arrays.toString(sigma) + "}";
    }
}
