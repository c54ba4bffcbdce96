/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

/**
 * How {@link ProjectAndLift#latticeBasisProjection} chooses the columns of the lattice basis to keep.
 */
public enum VariableSelection {
    /**
     * Greedily, left to right, keeping every column that increases the rank.
     */
    ANY,

    /**
     * The columns outside an optimal basis of the linear relaxation.
     */
    SIMPLEX_BASIS
}
