/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.relaxation;

import java.util.Arrays;

/**
 * A truncation weight w and its value w * v at the fiber solution. The all-zero weight disables truncation.
 */
public final class WeightVector {
    private final double[] weights;
    private final double value;

    WeightVector(final double[] weights, final double value) {
        this.weights = weights;
        this.value = value;
    }

    static WeightVector zero(final int n) {
        return new WeightVector(new double[n], 0.0);
    }

    public double[] weights() {
        return weights.clone();
    }

    public double value() {
        return value;
    }

    public boolean isZero() {
        for (final double w : weights) {
            if (w != 0.0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "WeightVector{" + Arrays.toString(weights) + ", value=" + value + "}";
    }
}
