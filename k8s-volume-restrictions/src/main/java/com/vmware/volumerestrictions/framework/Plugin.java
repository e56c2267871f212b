/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

/**
 * Base interface of all scheduling plugins.
 */
public interface Plugin {
    String name();
}
