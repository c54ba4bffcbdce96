/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

/**
 * Domain of a variable when a program is handed to a solver.
 */
public enum VariableKind {
    INTEGER,
    CONTINUOUS
}
