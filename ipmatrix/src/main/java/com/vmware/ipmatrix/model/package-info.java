/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

/**
 * A solver-agnostic linear constraint model: variables, linear constraints, bounds and one linear objective.
 * Models written against this package are turned into matrix form by
 * {@link com.vmware.ipmatrix.ModelExtractor}.
 */
@ParametersAreNonnullByDefault
package com.vmware.ipmatrix.model;

import javax.annotation.ParametersAreNonnullByDefault;
