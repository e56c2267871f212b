/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableSet;
import com.vmware.volumerestrictions.framework.ClusterEvent;
import com.vmware.volumerestrictions.framework.CycleState;
import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.Status;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmware.volumerestrictions.ReadWriteOncePodClaims.READ_WRITE_ONCE_POD;
import static com.vmware.volumerestrictions.TestPods.NAMESPACE;
import static com.vmware.volumerestrictions.TestPods.awsElasticBlockStore;
import static com.vmware.volumerestrictions.TestPods.claimVolume;
import static com.vmware.volumerestrictions.TestPods.emptyDir;
import static com.vmware.volumerestrictions.TestPods.gcePersistentDisk;
import static com.vmware.volumerestrictions.TestPods.newClaim;
import static com.vmware.volumerestrictions.TestPods.newPod;
import static com.vmware.volumerestrictions.TestPods.rbd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VolumeRestrictionsTest {

    private static VolumeRestrictions plugin(final ClaimLister lister, final ClusterSnapshot snapshot) {
        return new VolumeRestrictions(lister, () -> snapshot);
    }

    @Test
    public void testPreFilterSkipsPodsWithoutRelevantVolumes() {
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty());
        final CycleState cycleState = new CycleState();
        final Status status = plugin.preFilter(cycleState, newPod("p1", emptyDir("scratch")));
        assertEquals(Status.skip(), status);
        assertTrue(cycleState.isFilterSkipped(VolumeRestrictions.NAME));
        assertFalse(cycleState.contains(VolumeRestrictions.PRE_FILTER_STATE_KEY));

        // Filter, AddPod and RemovePod are no-ops for a skipped attempt
        final Pod other = newPod("p2", claimVolume("a", "c1"));
        assertTrue(plugin.filter(cycleState, newPod("p1"), NodeInfo.forPods(other)).isSuccess());
        assertTrue(plugin.addPod(cycleState, newPod("p1"), new PodInfo(other), NodeInfo.forPods()).isSuccess());
        assertTrue(plugin.removePod(cycleState, newPod("p1"), new PodInfo(other), NodeInfo.forPods()).isSuccess());
    }

    @Test
    public void testPreFilterSkipsUnusedExclusiveClaims() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final CycleState cycleState = new CycleState();
        final Status status = plugin(lister, ClusterSnapshot.empty())
                .preFilter(cycleState, newPod("p1", claimVolume("a", "c1")));
        assertTrue(status.isSkip());
    }

    @Test
    public void testPreFilterWritesStateForConflictVolumes() {
        final CycleState cycleState = new CycleState();
        final Status status = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty())
                .preFilter(cycleState, newPod("p1", gcePersistentDisk("a", "pd", false)));
        assertTrue(status.isSuccess());
        final PreFilterState state = VolumeRestrictions.getPreFilterState(cycleState);
        assertEquals(ImmutableSet.of(), state.readWriteOncePodClaims());
        assertEquals(0, state.conflictingClaimRefCount());
    }

    @Test
    public void testPreFilterMissingClaim() {
        final Status status = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty())
                .preFilter(new CycleState(), newPod("p1", claimVolume("a", "c1")));
        assertEquals(Status.Code.UNSCHEDULABLE_AND_UNRESOLVABLE, status.code());
        assertEquals("persistentvolumeclaim \"c1\" not found in namespace \"default\"", status.message());
    }

    @Test
    public void testPreFilterLookupFailure() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister().failOn(NAMESPACE, "c1");
        final Status status = plugin(lister, ClusterSnapshot.empty())
                .preFilter(new CycleState(), newPod("p1", claimVolume("a", "c1")));
        assertEquals(Status.Code.ERROR, status.code());
        assertInstanceOf(ClaimLookupException.class, status.error());
    }

    @Test
    public void testExclusiveClaimInUseRejectsEveryNode() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod holder = newPod("holder", NAMESPACE, "n1", 0, claimVolume("data", "c1"));
        final ClusterSnapshot snapshot = ClusterSnapshot.of(List.of("n1", "n2"), List.of(holder));
        final VolumeRestrictions plugin = plugin(lister, snapshot);
        final Pod pod = newPod("p1", claimVolume("data", "c1"));

        final CycleState cycleState = new CycleState();
        assertTrue(plugin.preFilter(cycleState, pod).isSuccess());
        assertEquals(1, VolumeRestrictions.getPreFilterState(cycleState).conflictingClaimRefCount());
        for (final NodeInfo nodeInfo : snapshot.nodeInfos()) {
            final Status status = plugin.filter(cycleState, pod, nodeInfo);
            assertEquals(Status.unschedulable(VolumeRestrictions.ERR_REASON_READ_WRITE_ONCE_POD_CONFLICT), status);
        }
    }

    @Test
    public void testExclusiveClaimInAnotherNamespaceDoesNotCount() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod holder = newPod("holder", "other", "n1", 0, claimVolume("data", "c1"));
        final ClusterSnapshot snapshot = ClusterSnapshot.of(List.of("n1"), List.of(holder));
        final Status status = plugin(lister, snapshot)
                .preFilter(new CycleState(), newPod("p1", claimVolume("data", "c1")));
        assertTrue(status.isSkip());
    }

    @Test
    public void testRemovingTheHolderMakesThePodFit() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod holder = newPod("holder", NAMESPACE, "n1", 0, claimVolume("data", "c1"));
        final ClusterSnapshot snapshot = ClusterSnapshot.of(List.of("n1"), List.of(holder));
        final VolumeRestrictions plugin = plugin(lister, snapshot);
        final Pod pod = newPod("p1", claimVolume("data", "c1"));
        final CycleState cycleState = new CycleState();
        plugin.preFilter(cycleState, pod);

        final NodeInfo n1 = snapshot.nodeInfo("n1");
        final PodInfo holderInfo = n1.pods().get(0);
        final NodeInfo withoutHolder = n1.withoutPod(holderInfo);
        assertTrue(plugin.removePod(cycleState, pod, holderInfo, withoutHolder).isSuccess());
        assertTrue(plugin.filter(cycleState, pod, withoutHolder).isSuccess());

        assertTrue(plugin.addPod(cycleState, pod, holderInfo, n1).isSuccess());
        assertEquals(Status.Code.UNSCHEDULABLE, plugin.filter(cycleState, pod, n1).code());
    }

    @Test
    public void testDiskConflictIsCheckedBeforeExclusiveClaims() {
        final Pod existing = newPod("existing", NAMESPACE, "n1", 0,
                                    rbd("b", List.of("m2"), "pool", "img", false));
        final ClusterSnapshot snapshot = ClusterSnapshot.of(List.of("n1", "n2"), List.of(existing));
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister(), snapshot);
        final Pod pod = newPod("p1", rbd("a", List.of("m1", "m2"), "pool", "img", false));
        final CycleState cycleState = new CycleState();
        assertTrue(plugin.preFilter(cycleState, pod).isSuccess());

        assertEquals(Status.unschedulable(VolumeRestrictions.ERR_REASON_DISK_CONFLICT),
                     plugin.filter(cycleState, pod, snapshot.nodeInfo("n1")));
        assertTrue(plugin.filter(cycleState, pod, snapshot.nodeInfo("n2")).isSuccess());
    }

    @Test
    public void testDiskConflictWithoutPreFilter() {
        final Pod existing = newPod("existing", NAMESPACE, "n1", 0, awsElasticBlockStore("b", "vol-1", true));
        final Pod pod = newPod("p1", awsElasticBlockStore("a", "vol-1", true));
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty());
        assertEquals(Status.unschedulable(VolumeRestrictions.ERR_REASON_DISK_CONFLICT),
                     plugin.filter(new CycleState(), pod, NodeInfo.forPods(existing)));
    }

    @Test
    public void testMissingStateIsAnError() {
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty());
        final Pod pod = newPod("p1", gcePersistentDisk("a", "pd", false));
        final Pod other = newPod("p2");
        final CycleState cycleState = new CycleState();

        final Status filter = plugin.filter(cycleState, pod, NodeInfo.forPods(other));
        assertEquals(Status.Code.ERROR, filter.code());
        assertEquals("cannot read \"PreFilterVolumeRestrictions\" from cycleState", filter.message());
        assertEquals(Status.Code.ERROR,
                     plugin.addPod(cycleState, pod, new PodInfo(other), NodeInfo.forPods()).code());
        assertEquals(Status.Code.ERROR,
                     plugin.removePod(cycleState, pod, new PodInfo(other), NodeInfo.forPods()).code());
    }

    @Test
    public void testEventsToRegister() {
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister(), ClusterSnapshot.empty());
        assertEquals(3, plugin.eventsToRegister().size());
        assertTrue(plugin.eventsToRegister().stream()
                         .anyMatch(e -> e.event().resource() == ClusterEvent.Resource.NODE
                                 && e.queueingHintFn() == null));
    }
}
