/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Canonical matrix form of integer programs. Parameters are non-null unless annotated otherwise.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix;

import javax.annotation.ParametersAreNonnullByDefault;
