/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Exact integer linear algebra. Matrices are plain row-major {@code long[][]} arrays; intermediate values
 * are computed over {@link java.math.BigInteger} and converted back with exact conversions, so results are
 * either exact or an {@link java.lang.ArithmeticException} is thrown.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.linalg;

import javax.annotation.ParametersAreNonnullByDefault;
