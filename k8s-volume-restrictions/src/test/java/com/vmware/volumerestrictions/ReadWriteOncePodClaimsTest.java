/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableSet;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmware.volumerestrictions.ReadWriteOncePodClaims.READ_WRITE_ONCE_POD;
import static com.vmware.volumerestrictions.TestPods.NAMESPACE;
import static com.vmware.volumerestrictions.TestPods.claimVolume;
import static com.vmware.volumerestrictions.TestPods.emptyDir;
import static com.vmware.volumerestrictions.TestPods.newClaim;
import static com.vmware.volumerestrictions.TestPods.newPod;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReadWriteOncePodClaimsTest {

    @Test
    public void testOnlyExclusiveClaimsAreReturned() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD))
                .add(newClaim(NAMESPACE, "c2", "ReadWriteOnce"))
                .add(newClaim(NAMESPACE, "c3", "ReadOnlyMany", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("a", "c1"), emptyDir("b"), claimVolume("c", "c2"),
                               claimVolume("d", "c3"));
        assertEquals(ImmutableSet.of("c1", "c3"), new ReadWriteOncePodClaims(lister).forPod(pod, false));
    }

    @Test
    public void testMissingClaimIsAnErrorUnlessIgnored() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim(NAMESPACE, "c1", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("a", "missing"), claimVolume("b", "c1"));
        final ReadWriteOncePodClaims claims = new ReadWriteOncePodClaims(lister);

        final ClaimNotFoundException e = assertThrows(ClaimNotFoundException.class, () -> claims.forPod(pod, false));
        assertEquals("missing", e.claimName());
        assertEquals(NAMESPACE, e.namespace());
        assertEquals("persistentvolumeclaim \"missing\" not found in namespace \"default\"", e.getMessage());

        assertEquals(ImmutableSet.of("c1"), claims.forPod(pod, true));
    }

    @Test
    public void testLookupFailuresAreNeverIgnored() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister().failOn(NAMESPACE, "c1");
        final Pod pod = newPod("p1", claimVolume("a", "c1"));
        final ReadWriteOncePodClaims claims = new ReadWriteOncePodClaims(lister);
        assertThrows(ClaimLookupException.class, () -> claims.forPod(pod, true));
    }

    @Test
    public void testClaimsAreLookedUpInThePodNamespace() {
        final TestPods.MapClaimLister lister = new TestPods.MapClaimLister()
                .add(newClaim("other", "c1", READ_WRITE_ONCE_POD));
        final Pod pod = newPod("p1", claimVolume("a", "c1"));
        assertThrows(ClaimNotFoundException.class, () -> new ReadWriteOncePodClaims(lister).forPod(pod, false));
    }

    @Test
    public void testClaimNames() {
        final Pod pod = newPod("p1", claimVolume("a", "c1"), emptyDir("b"), claimVolume("c", "c2"));
        assertEquals(List.of("c1", "c2"), ReadWriteOncePodClaims.claimNames(pod));
        assertEquals(List.of(), ReadWriteOncePodClaims.claimNames(newPod("p2")));
    }

    @Test
    public void testClaimWithoutSpec() {
        final PersistentVolumeClaim claim = newClaim(NAMESPACE, "c1");
        assertFalse(ReadWriteOncePodClaims.hasReadWriteOncePodAccessMode(claim));
        claim.setSpec(null);
        assertFalse(ReadWriteOncePodClaims.hasReadWriteOncePodAccessMode(claim));
        assertTrue(ReadWriteOncePodClaims.hasReadWriteOncePodAccessMode(
                newClaim(NAMESPACE, "c2", READ_WRITE_ONCE_POD)));
    }
}
