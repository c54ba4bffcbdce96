/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.model;

public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE
}
