/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import io.fabric8.kubernetes.api.model.Pod;

public interface PreFilterExtensions {

    Status addPod(CycleState cycleState, Pod podToSchedule, PodInfo podInfoToAdd, NodeInfo nodeInfo);

    Status removePod(CycleState cycleState, Pod podToSchedule, PodInfo podInfoToRemove, NodeInfo nodeInfo);
}
