/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Instances derived from other instances (nonnegativity and group relaxations, projections, extra
 * constraints) and the LP-based building blocks of project-and-lift.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.relaxation;

import javax.annotation.ParametersAreNonnullByDefault;
