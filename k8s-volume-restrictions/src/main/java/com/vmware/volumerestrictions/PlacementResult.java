/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.Status;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The verdict of one scheduling attempt.
 *
 * @param pod the pod that was evaluated
 * @param preFilterStatus the first non-successful PreFilter status, or success
 * @param nodeStatuses the filter verdict for every node that was filtered, keyed by node name
 * @param feasibleNodes nodes on which the pod fits as things are
 * @param preemptionVictims for nodes where evicting lower priority pods would make room, the pods
 *                          that would have to go. Nothing is evicted.
 * @param rejectorPlugins plugins that returned an unschedulable verdict during this attempt
 */
record PlacementResult(Pod pod, Status preFilterStatus, Map<String, Status> nodeStatuses,
                       List<String> feasibleNodes, Map<String, List<PodInfo>> preemptionVictims,
                       Set<String> rejectorPlugins) {

    boolean isSchedulable() {
        return !feasibleNodes.isEmpty();
    }

    @Override
    public String toString() {
        return "PlacementResult{" +
                "pod=" + pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName() +
                ", preFilterStatus=" + preFilterStatus +
                ", feasibleNodes=" + feasibleNodes +
                ", nodeStatuses=" + nodeStatuses +
                ", preemptionVictims=" + preemptionVictims.keySet() +
                '}';
    }
}
