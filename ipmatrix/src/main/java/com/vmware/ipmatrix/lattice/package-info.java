/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Integer lattices attached to an equality system: kernel bases, particular integer solutions and lifting
 * between a projected lattice and the full one.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.lattice;

import javax.annotation.ParametersAreNonnullByDefault;
