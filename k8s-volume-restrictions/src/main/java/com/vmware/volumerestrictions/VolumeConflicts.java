/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Volume;

import java.util.List;
import java.util.Optional;

/**
 * Disk conflict checks between a pod and the pods already assigned to a node.
 */
final class VolumeConflicts {

    private VolumeConflicts() {
    }

    /**
     * Whether {@code volume} conflicts with any volume of {@code existingPod}.
     */
    static boolean isVolumeConflict(final ConflictVolume volume, final Pod existingPod) {
        for (final Volume existingVolume : PodInfo.volumesOf(existingPod)) {
            final Optional<ConflictVolume> existing = ConflictVolume.of(existingVolume);
            if (existing.isPresent() && volume.conflictsWith(existing.get())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if scheduling the pod onto this node would cause any conflicts with existing volumes.
     * Stops at the first conflict.
     */
    static boolean satisfyVolumeConflicts(final Pod pod, final NodeInfo nodeInfo) {
        final List<PodInfo> existingPods = nodeInfo.pods();
        for (final Volume v : PodInfo.volumesOf(pod)) {
            final Optional<ConflictVolume> volume = ConflictVolume.of(v);
            if (volume.isEmpty()) {
                continue;
            }
            for (final PodInfo existingPod : existingPods) {
                if (isVolumeConflict(volume.get(), existingPod.pod())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Whether any volume of the pod is of a kind that takes part in conflict checks.
     */
    static boolean needsRestrictionsCheck(final Pod pod) {
        return PodInfo.volumesOf(pod).stream().anyMatch(ConflictVolume::needsRestrictionsCheck);
    }
}
