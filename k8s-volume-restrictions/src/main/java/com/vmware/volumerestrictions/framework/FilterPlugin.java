/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import io.fabric8.kubernetes.api.model.Pod;

/**
 * Invoked once per candidate node. Implementations must be safe to call concurrently for
 * different nodes with the same cycle state.
 */
public interface FilterPlugin extends Plugin {
    Status filter(CycleState cycleState, Pod pod, NodeInfo nodeInfo);
}
