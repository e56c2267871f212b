/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vmware.volumerestrictions.framework.ClusterEvent;
import com.vmware.volumerestrictions.framework.ClusterEventWithHint;
import com.vmware.volumerestrictions.framework.CycleState;
import com.vmware.volumerestrictions.framework.EnqueueExtensions;
import com.vmware.volumerestrictions.framework.FilterPlugin;
import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.PreFilterExtensions;
import com.vmware.volumerestrictions.framework.PreFilterPlugin;
import com.vmware.volumerestrictions.framework.QueueingHint;
import com.vmware.volumerestrictions.framework.StateMissingException;
import com.vmware.volumerestrictions.framework.Status;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.ADD;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.DELETE;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.UPDATE;

/**
 * A plugin that checks volume restrictions.
 *
 * Filter evaluates if a pod can fit due to the volumes it requests and those that are already
 * mounted on the node. This is GCE PD, AWS EBS, iSCSI and Ceph RBD specific:
 * <ul>
 *   <li>GCE PD allows multiple mounts as long as they are all read-only</li>
 *   <li>AWS EBS forbids any two pods mounting the same volume id</li>
 *   <li>Ceph RBD forbids two pods sharing a monitor, pool and image unless both are read-only</li>
 *   <li>iSCSI forbids two pods sharing an IQN unless both are read-only</li>
 * </ul>
 * If the pod uses claims with the ReadWriteOncePod access mode, it also checks whether these claims are
 * already in use anywhere in the cluster, and whether preemption would help.
 */
public class VolumeRestrictions implements PreFilterPlugin, FilterPlugin, PreFilterExtensions, EnqueueExtensions {
    private static final Logger LOG = LoggerFactory.getLogger(VolumeRestrictions.class);
    public static final String NAME = "VolumeRestrictions";
    static final String PRE_FILTER_STATE_KEY = "PreFilter" + NAME;
    public static final String ERR_REASON_DISK_CONFLICT = "node(s) had no available disk";
    public static final String ERR_REASON_READ_WRITE_ONCE_POD_CONFLICT =
            "node has pod using PersistentVolumeClaim with the same name and ReadWriteOncePod access mode";

    private final ClaimLister claimLister;
    private final ReadWriteOncePodClaims readWriteOncePodClaims;
    private final Supplier<ClusterSnapshot> snapshot;

    public VolumeRestrictions(final ClaimLister claimLister, final Supplier<ClusterSnapshot> snapshot) {
        this.claimLister = claimLister;
        this.readWriteOncePodClaims = new ReadWriteOncePodClaims(claimLister);
        this.snapshot = snapshot;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Computes and stores the cycle state used to enforce ReadWriteOncePod. Returns a skip status when
     * the pod has no volume subject to conflict checks and none of its ReadWriteOncePod claims is in use.
     */
    @Override
    public Status preFilter(final CycleState cycleState, final Pod pod) {
        final boolean needsCheck = VolumeConflicts.needsRestrictionsCheck(pod);
        final ImmutableSet<String> claims;
        try {
            claims = readWriteOncePodClaims.forPod(pod, false);
        } catch (final ClaimNotFoundException e) {
            return Status.unschedulableAndUnresolvable(e.getMessage());
        } catch (final ClaimLookupException e) {
            LOG.warn("Claim lookup for pod {}/{} failed", pod.getMetadata().getNamespace(),
                     pod.getMetadata().getName(), e);
            return Status.asStatus(e);
        }
        final PreFilterState state = computePreFilterState(pod, claims);
        if (!needsCheck && state.conflictingClaimRefCount() == 0) {
            cycleState.skipFilter(NAME);
            return Status.skip();
        }
        cycleState.write(PRE_FILTER_STATE_KEY, state);
        return Status.success();
    }

    /**
     * Counts how many of the pod's ReadWriteOncePod claims are already used by a scheduled pod. There
     * can be at most one such pod per claim.
     */
    private PreFilterState computePreFilterState(final Pod pod, final ImmutableSet<String> claims) {
        final ClusterSnapshot clusterSnapshot = snapshot.get();
        int conflictingClaimRefCount = 0;
        for (final String claim : claims) {
            if (clusterSnapshot.isClaimUsedByPods(
                    ClusterSnapshot.namespacedName(pod.getMetadata().getNamespace(), claim))) {
                conflictingClaimRefCount += 1;
            }
        }
        return new PreFilterState(claims, conflictingClaimRefCount);
    }

    @Override
    public PreFilterExtensions preFilterExtensions() {
        return this;
    }

    @Override
    public Status addPod(final CycleState cycleState, final Pod podToSchedule, final PodInfo podInfoToAdd,
                         final NodeInfo nodeInfo) {
        if (cycleState.isFilterSkipped(NAME)) {
            return Status.success();
        }
        final PreFilterState state;
        try {
            state = getPreFilterState(cycleState);
        } catch (final StateMissingException e) {
            return Status.asStatus(e);
        }
        state.updateWithPod(podInfoToAdd, 1);
        return Status.success();
    }

    @Override
    public Status removePod(final CycleState cycleState, final Pod podToSchedule, final PodInfo podInfoToRemove,
                            final NodeInfo nodeInfo) {
        if (cycleState.isFilterSkipped(NAME)) {
            return Status.success();
        }
        final PreFilterState state;
        try {
            state = getPreFilterState(cycleState);
        } catch (final StateMissingException e) {
            return Status.asStatus(e);
        }
        state.updateWithPod(podInfoToRemove, -1);
        return Status.success();
    }

    @VisibleForTesting
    static PreFilterState getPreFilterState(final CycleState cycleState) {
        // A missing entry means PreFilter was not invoked for this attempt
        return cycleState.read(PRE_FILTER_STATE_KEY, PreFilterState.class);
    }

    /**
     * Rejects the node if the pod's volumes conflict with those of the pods already on it, or if one of
     * the pod's ReadWriteOncePod claims is in use.
     */
    @Override
    public Status filter(final CycleState cycleState, final Pod pod, final NodeInfo nodeInfo) {
        if (!VolumeConflicts.satisfyVolumeConflicts(pod, nodeInfo)) {
            return Status.unschedulable(ERR_REASON_DISK_CONFLICT);
        }
        if (cycleState.isFilterSkipped(NAME)) {
            // PreFilter found no claim in use, nothing left to check
            return Status.success();
        }
        final PreFilterState state;
        try {
            state = getPreFilterState(cycleState);
        } catch (final StateMissingException e) {
            return Status.asStatus(e);
        }
        return satisfyReadWriteOncePod(state);
    }

    private static Status satisfyReadWriteOncePod(final PreFilterState state) {
        if (state.conflictingClaimRefCount() > 0) {
            return Status.unschedulable(ERR_REASON_READ_WRITE_ONCE_POD_CONFLICT);
        }
        return Status.success();
    }

    /**
     * The events that may make a pod rejected by this plugin schedulable.
     */
    @Override
    public List<ClusterEventWithHint> eventsToRegister() {
        return ImmutableList.of(
                // Once running pods are deleted and their volumes released, the pod may fit.
                // Volumes of a pod are immutable, so pod updates are ignored.
                new ClusterEventWithHint(new ClusterEvent(ClusterEvent.Resource.POD, DELETE),
                                         this::isSchedulableAfterPodDeleted),
                // Any new node may fit the pod, no hint needed
                new ClusterEventWithHint(new ClusterEvent(ClusterEvent.Resource.NODE, ADD)),
                // The pod may be waiting for a claim to be created so that its access modes can be checked
                new ClusterEventWithHint(new ClusterEvent(ClusterEvent.Resource.PERSISTENT_VOLUME_CLAIM, ADD, UPDATE),
                                         this::isSchedulableAfterClaimChange)
        );
    }

    /**
     * Invoked when a pod is deleted. Checks whether the deleted pod held a ReadWriteOncePod claim the
     * waiting pod needs, or had a volume that conflicted with it.
     */
    QueueingHint isSchedulableAfterPodDeleted(final Pod pod, @Nullable final Object oldObj,
                                              @Nullable final Object newObj) {
        if (!(oldObj instanceof Pod deletedPod) || newObj != null) {
            throw new UnexpectedEventPayloadException(String.format(
                    "unexpected objects in isSchedulableAfterPodDeleted: %s, %s", typeOf(oldObj), typeOf(newObj)));
        }
        if (!Objects.equals(deletedPod.getMetadata().getNamespace(), pod.getMetadata().getNamespace())) {
            return QueueingHint.QUEUE_SKIP;
        }

        final ImmutableSet<String> podClaims;
        try {
            podClaims = readWriteOncePodClaims.forPod(pod, false);
        } catch (final ClaimNotFoundException e) {
            LOG.debug("No claim for pod {} found, it won't be schedulable until the claim is created: {}",
                      pod.getMetadata().getName(), e.getMessage());
            return QueueingHint.QUEUE_SKIP;
        }

        // The deleted pod may have had claims that are gone as well. They can be ignored: a pod using
        // such a claim is not schedulable until the claim is recreated, and a pod not using it is
        // unaffected. The deleted pod's remaining claims still need checking.
        final ImmutableSet<String> deletedPodClaims = readWriteOncePodClaims.forPod(deletedPod, true);
        for (final String claim : deletedPodClaims) {
            if (podClaims.contains(claim)) {
                return QueueingHint.QUEUE;
            }
        }

        if (!VolumeConflicts.satisfyVolumeConflicts(pod, NodeInfo.forPods(deletedPod))) {
            return QueueingHint.QUEUE;
        }
        return QueueingHint.QUEUE_SKIP;
    }

    /**
     * Invoked when a claim is added or updated. Only the creation of a claim the pod references can
     * make it schedulable.
     */
    QueueingHint isSchedulableAfterClaimChange(final Pod pod, @Nullable final Object oldObj,
                                               @Nullable final Object newObj) {
        if (!(newObj instanceof PersistentVolumeClaim newClaim)
                || (oldObj != null && !(oldObj instanceof PersistentVolumeClaim))) {
            throw new UnexpectedEventPayloadException(String.format(
                    "unexpected objects in isSchedulableAfterClaimChange: %s, %s", typeOf(oldObj), typeOf(newObj)));
        }
        final String namespace = pod.getMetadata().getNamespace();
        if (oldObj != null || !Objects.equals(newClaim.getMetadata().getNamespace(), namespace)) {
            return QueueingHint.QUEUE_SKIP;
        }

        final ImmutableSet.Builder<String> claims = ImmutableSet.builder();
        for (final String claimName : ReadWriteOncePodClaims.claimNames(pod)) {
            try {
                claimLister.get(namespace, claimName);
                claims.add(claimName);
            } catch (final ClaimNotFoundException e) {
                LOG.debug("Claim {} for pod {} is not created yet, it won't be schedulable until then",
                          claimName, pod.getMetadata().getName());
                return QueueingHint.QUEUE_SKIP;
            }
        }
        if (claims.build().contains(newClaim.getMetadata().getName())) {
            return QueueingHint.QUEUE;
        }
        return QueueingHint.QUEUE_SKIP;
    }

    private static String typeOf(@Nullable final Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
