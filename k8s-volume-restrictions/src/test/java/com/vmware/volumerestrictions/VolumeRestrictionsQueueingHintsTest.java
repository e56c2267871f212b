/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.QueueingHint;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.Test;

import static com.vmware.volumerestrictions.ReadWriteOncePodClaims.READ_WRITE_ONCE_POD;
import static com.vmware.volumerestrictions.TestPods.NAMESPACE;
import static com.vmware.volumerestrictions.TestPods.claimVolume;
import static com.vmware.volumerestrictions.TestPods.gcePersistentDisk;
import static com.vmware.volumerestrictions.TestPods.newClaim;
import static com.vmware.volumerestrictions.TestPods.newNode;
import static com.vmware.volumerestrictions.TestPods.newPod;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VolumeRestrictionsQueueingHintsTest {

    private static VolumeRestrictions plugin(final ClaimLister lister) {
        return new VolumeRestrictions(lister, ClusterSnapshot::empty);
    }

    @Test
    public void testDeletedHolderOfExclusiveClaim() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("data", "c1"));
        final Pod holder = newPod("holder", NAMESPACE, "n1", 0, claimVolume("data", "c1"));
        assertEquals(QueueingHint.QUEUE, plugin(lister).isSchedulableAfterPodDeleted(pod, holder, null));
    }

    @Test
    public void testDeletedPodInAnotherNamespace() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("data", "c1"));
        final Pod other = newPod("holder", "other", "n1", 0, claimVolume("data", "c1"));
        assertEquals(QueueingHint.QUEUE_SKIP, plugin(lister).isSchedulableAfterPodDeleted(pod, other, null));
    }

    @Test
    public void testDeletedPodWithConflictingDisk() {
        final Pod pod = newPod("p1", gcePersistentDisk("a", "pd", false));
        final Pod holder = newPod("holder", NAMESPACE, "n1", 0, gcePersistentDisk("a", "pd", true));
        final Pod unrelated = newPod("unrelated", NAMESPACE, "n1", 0, gcePersistentDisk("a", "pd2", false));
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister());
        assertEquals(QueueingHint.QUEUE, plugin.isSchedulableAfterPodDeleted(pod, holder, null));
        assertEquals(QueueingHint.QUEUE_SKIP, plugin.isSchedulableAfterPodDeleted(pod, unrelated, null));
    }

    @Test
    public void testPodWithMissingClaimIsNotRequeuedOnDelete() {
        final Pod pod = newPod("p1", claimVolume("data", "missing"));
        final Pod deleted = newPod("holder", NAMESPACE, "n1", 0, claimVolume("data", "missing"));
        assertEquals(QueueingHint.QUEUE_SKIP,
                     plugin(new TestPods.MapClaimLister()).isSchedulableAfterPodDeleted(pod, deleted, null));
    }

    @Test
    public void testDeletedPodClaimsThatAreGoneAreIgnored() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("data", "c1"));
        final Pod deleted = newPod("holder", NAMESPACE, "n1", 0, claimVolume("gone", "gone"),
                                   claimVolume("data", "c1"));
        assertEquals(QueueingHint.QUEUE, plugin(lister).isSchedulableAfterPodDeleted(pod, deleted, null));
    }

    @Test
    public void testLookupFailurePropagatesFromPodDeleteHint() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister().failOn(NAMESPACE, "c1");
        final Pod pod = newPod("p1", claimVolume("data", "c1"));
        final Pod deleted = newPod("holder", NAMESPACE, "n1", 0);
        assertThrows(ClaimLookupException.class,
                     () -> plugin(lister).isSchedulableAfterPodDeleted(pod, deleted, null));
    }

    @Test
    public void testUnexpectedPodDeletePayload() {
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister());
        final Pod pod = newPod("p1");
        final Node node = newNode("n1");
        assertThrows(UnexpectedEventPayloadException.class,
                     () -> plugin.isSchedulableAfterPodDeleted(pod, node, null));
        assertThrows(UnexpectedEventPayloadException.class,
                     () -> plugin.isSchedulableAfterPodDeleted(pod, null, newPod("p2")));
    }

    @Test
    public void testClaimCreatedThenUpdated() {
        final PersistentVolumeClaim c2 = newClaim(NAMESPACE, "c2", READ_WRITE_ONCE_POD);
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", "ReadWriteOnce"))
                .add(c2);
        final Pod pod = newPod("p1", claimVolume("a", "c1"), claimVolume("b", "c2"));
        final VolumeRestrictions plugin = plugin(lister);
        assertEquals(QueueingHint.QUEUE, plugin.isSchedulableAfterClaimChange(pod, null, c2));
        final PersistentVolumeClaim updated = newClaim(NAMESPACE, "c2", READ_WRITE_ONCE_POD);
        assertEquals(QueueingHint.QUEUE_SKIP, plugin.isSchedulableAfterClaimChange(pod, c2, updated));
    }

    @Test
    public void testUnrelatedClaimCreated() {
        final PersistentVolumeClaim c9 = newClaim(NAMESPACE, "c9", READ_WRITE_ONCE_POD);
        final PersistentVolumeClaim elsewhere = newClaim("other", "c1", READ_WRITE_ONCE_POD);
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD))
                .add(c9)
                .add(elsewhere);
        final Pod pod = newPod("p1", claimVolume("a", "c1"));
        final VolumeRestrictions plugin = plugin(lister);
        assertEquals(QueueingHint.QUEUE_SKIP, plugin.isSchedulableAfterClaimChange(pod, null, c9));
        assertEquals(QueueingHint.QUEUE_SKIP, plugin.isSchedulableAfterClaimChange(pod, null, elsewhere));
    }

    @Test
    public void testClaimCreatedWhileAnotherIsStillMissing() {
        final PersistentVolumeClaim c1 = newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD);
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister().add(c1);
        final Pod pod = newPod("p1", claimVolume("a", "c1"), claimVolume("b", "c2"));
        assertEquals(QueueingHint.QUEUE_SKIP, plugin(lister).isSchedulableAfterClaimChange(pod, null, c1));
    }

    @Test
    public void testUnexpectedClaimPayload() {
        final VolumeRestrictions plugin = plugin(new TestPods.MapClaimLister());
        final Pod pod = newPod("p1");
        assertThrows(UnexpectedEventPayloadException.class,
                     () -> plugin.isSchedulableAfterClaimChange(pod, null, newPod("p2")));
        assertThrows(UnexpectedEventPayloadException.class,
                     () -> plugin.isSchedulableAfterClaimChange(pod, newNode("n1"),
                                                                newClaim(NAMESPACE, "c1")));
    }
}
