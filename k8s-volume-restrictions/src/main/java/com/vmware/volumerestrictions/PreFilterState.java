/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableSet;
import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.StateData;

/**
 * Computed at PreFilter and read at Filter. The claim set is shared between copies, the counter is not.
 */
final class PreFilterState implements StateData {
    // Names of the pod's claims using the ReadWriteOncePod access mode
    private final ImmutableSet<String> readWriteOncePodClaims;
    // The number of references to these claims by scheduled pods
    private int conflictingClaimRefCount;

    PreFilterState(final ImmutableSet<String> readWriteOncePodClaims, final int conflictingClaimRefCount) {
        this.readWriteOncePodClaims = readWriteOncePodClaims;
        this.conflictingClaimRefCount = conflictingClaimRefCount;
    }

    ImmutableSet<String> readWriteOncePodClaims() {
        return readWriteOncePodClaims;
    }

    int conflictingClaimRefCount() {
        return conflictingClaimRefCount;
    }

    /**
     * Adjusts the counter for a pod hypothetically added (multiplier 1) to or removed (multiplier -1)
     * from the cluster.
     */
    void updateWithPod(final PodInfo podInfo, final int multiplier) {
        conflictingClaimRefCount += multiplier * conflictingClaimRefCountForPod(podInfo);
    }

    int conflictingClaimRefCountForPod(final PodInfo podInfo) {
        int conflicts = 0;
        for (final String claimName : ReadWriteOncePodClaims.claimNames(podInfo.pod())) {
            if (readWriteOncePodClaims.contains(claimName)) {
                conflicts += 1;
            }
        }
        return conflicts;
    }

    @Override
    public PreFilterState copy() {
        return new PreFilterState(readWriteOncePodClaims, conflictingClaimRefCount);
    }

    @Override
    public String toString() {
        return "PreFilterState{" +
                "readWriteOncePodClaims=" + readWriteOncePodClaims +
                ", conflictingClaimRefCount=" + conflictingClaimRefCount +
                '}';
    }
}
