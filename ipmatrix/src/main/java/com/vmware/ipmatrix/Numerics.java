/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix;

/**
 * Tolerances used whenever a floating point value coming out of the oracle is compared against an exact one.
 * Values within EPSILON of the boundary may be classified either way.
 */
public final class Numerics {
    public static final double EPSILON = 0.0001;

    private Numerics() {
    }

    public static boolean approxEqual(final double x, final double y) {
        return Math.abs(x - y) < EPSILON;
    }

    public static boolean isApproxZero(final double x) {
        return approxEqual(x, 0.0);
    }

    /**
     * Rounds x to the nearest long, provided it is within EPSILON of it.
     *
     * @throws ArithmeticException if x is not integral within tolerance or does not fit in a long
     */
    public static long toIntegral(final double x) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            throw new ArithmeticException("Not a finite value: " + x);
        }
        final double rounded = Math.rint(x);
        if (!approxEqual(x, rounded)) {
            throw new ArithmeticException("Not an integral value: " + x);
        }
        if (rounded > Long.MAX_VALUE || rounded < Long.MIN_VALUE) {
            throw new ArithmeticException("Value out of range: " + x);
        }
        return (long) rounded;
    }
}
