/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.ClusterEvent;

import javax.annotation.Nullable;

/**
 * Receives cluster events along with the objects before and after the change. For additions
 * {@code oldObj} is null, for deletions {@code newObj} is null.
 */
@FunctionalInterface
interface ClusterEventListener {
    void onClusterEvent(ClusterEvent event, @Nullable Object oldObj, @Nullable Object newObj);
}
