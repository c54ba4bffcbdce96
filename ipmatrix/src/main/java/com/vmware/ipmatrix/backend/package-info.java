/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * The contract between the instance engine and an external LP/IP solver, together with the programs the
 * engine sends through it.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.backend;

import javax.annotation.ParametersAreNonnullByDefault;
