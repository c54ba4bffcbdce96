/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * {@link com.vmware.ipmatrix.backend.LpOracle} backed by the OR-Tools linear solver wrapper.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.backend.ortools;

import javax.annotation.ParametersAreNonnullByDefault;
