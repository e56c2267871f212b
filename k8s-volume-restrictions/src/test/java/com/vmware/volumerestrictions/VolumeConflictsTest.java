/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.NodeInfo;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmware.volumerestrictions.TestPods.awsElasticBlockStore;
import static com.vmware.volumerestrictions.TestPods.claimVolume;
import static com.vmware.volumerestrictions.TestPods.emptyDir;
import static com.vmware.volumerestrictions.TestPods.gcePersistentDisk;
import static com.vmware.volumerestrictions.TestPods.newPod;
import static com.vmware.volumerestrictions.TestPods.rbd;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VolumeConflictsTest {

    @Test
    public void testEmptyNodeNeverConflicts() {
        final Pod pod = newPod("p1", gcePersistentDisk("a", "pd", false));
        assertTrue(VolumeConflicts.satisfyVolumeConflicts(pod, NodeInfo.forPods()));
    }

    @Test
    public void testConflictWithAnyResidentPod() {
        final Pod pod = newPod("p1", emptyDir("scratch"), awsElasticBlockStore("a", "vol-1", false));
        final Pod unrelated = newPod("p2", gcePersistentDisk("a", "pd", false));
        final Pod holder = newPod("p3", emptyDir("x"), awsElasticBlockStore("b", "vol-1", false));
        assertTrue(VolumeConflicts.satisfyVolumeConflicts(pod, NodeInfo.forPods(unrelated)));
        assertFalse(VolumeConflicts.satisfyVolumeConflicts(pod, NodeInfo.forPods(unrelated, holder)));
    }

    @Test
    public void testRbdSharedMonitorConflict() {
        final Pod pod = newPod("p1", rbd("a", List.of("m1", "m2"), "pool", "img", false));
        final Pod existing = newPod("p2", rbd("b", List.of("m2"), "pool", "img", false));
        assertFalse(VolumeConflicts.satisfyVolumeConflicts(pod, NodeInfo.forPods(existing)));
    }

    @Test
    public void testIsVolumeConflict() {
        final Pod existing = newPod("p2", gcePersistentDisk("a", "pd", true), emptyDir("scratch"));
        assertFalse(VolumeConflicts.isVolumeConflict(new ConflictVolume.GcePersistentDisk("pd", true), existing));
        assertTrue(VolumeConflicts.isVolumeConflict(new ConflictVolume.GcePersistentDisk("pd", false), existing));
    }

    @Test
    public void testNeedsRestrictionsCheck() {
        assertFalse(VolumeConflicts.needsRestrictionsCheck(newPod("p1")));
        assertFalse(VolumeConflicts.needsRestrictionsCheck(newPod("p1", emptyDir("a"), claimVolume("b", "c1"))));
        assertTrue(VolumeConflicts.needsRestrictionsCheck(newPod("p1", emptyDir("a"),
                                                                 gcePersistentDisk("b", "pd", true))));
    }
}
