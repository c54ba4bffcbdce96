/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

/**
 * Thrown when a constraint model cannot be turned into matrix data, for instance because a term refers to
 * a variable the model does not own, or because a coefficient is not integral.
 */
public class MalformedModelException extends RuntimeException {
    public MalformedModelException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public MalformedModelException(final String message) {
        super(message);
    }
}
