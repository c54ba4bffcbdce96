/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

/**
 * Thrown while building an instance whose equality system, linear relaxation or integer lattice coset is
 * empty. Every IPInstance is feasible, so construction fails as soon as this is detected.
 */
public class InfeasibleRelaxationException extends RuntimeException {
    public InfeasibleRelaxationException(final String message) {
        super(message);
    }
}
