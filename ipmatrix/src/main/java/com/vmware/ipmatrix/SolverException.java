/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * An exception thrown when invoking the LP/IP oracle. Used when the solver reports a status the
 * oracle contract does not know how to interpret, or when a solver backend is not available.
 *
 * Optionally carries the raw status reported by the backend.
 */
public class SolverException extends RuntimeException {
    private final String reason;
    @Nullable private final String status;

    public SolverException(final String reason) {
        super(reason);
        this.reason = reason;
        this.status = null;
    }

    public SolverException(final String reason, final String status) {
        super(reason + " (status: " + status + ")");
        this.reason = reason;
        this.status = status;
    }

    public String reason() {
        return reason;
    }

    public Optional<String> status() {
        return Optional.ofNullable(status);
    }
}
