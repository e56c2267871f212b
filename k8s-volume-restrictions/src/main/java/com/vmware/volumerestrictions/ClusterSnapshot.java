/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import io.fabric8.kubernetes.api.model.Pod;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/**
 * A point-in-time view of which pods are assigned to which nodes. Taken once per scheduling
 * cycle and never mutated afterwards, so it can be read from any number of filter threads.
 */
public final class ClusterSnapshot {
    private final ImmutableMap<String, NodeInfo> nodeInfos;
    private final ImmutableSet<String> claimsUsedByPods;

    private ClusterSnapshot(final ImmutableMap<String, NodeInfo> nodeInfos,
                            final ImmutableSet<String> claimsUsedByPods) {
        this.nodeInfos = nodeInfos;
        this.claimsUsedByPods = claimsUsedByPods;
    }

    /**
     * Builds a snapshot from the known nodes and the pods assigned to nodes. Pods whose node is not
     * among {@code nodeNames} still count as users of their claims.
     */
    static ClusterSnapshot of(final Collection<String> nodeNames, final Collection<Pod> assignedPods) {
        final ListMultimap<String, PodInfo> podsByNode = LinkedListMultimap.create();
        final ImmutableSet.Builder<String> claims = ImmutableSet.builder();
        for (final Pod pod : assignedPods) {
            final PodInfo podInfo = new PodInfo(pod);
            if (podInfo.nodeName() == null) {
                continue;
            }
            podsByNode.put(podInfo.nodeName(), podInfo);
            for (final String claimName : ReadWriteOncePodClaims.claimNames(pod)) {
                claims.add(namespacedName(podInfo.namespace(), claimName));
            }
        }
        final ImmutableMap.Builder<String, NodeInfo> nodes = ImmutableMap.builder();
        for (final String nodeName : ImmutableSet.copyOf(nodeNames)) {
            nodes.put(nodeName, new NodeInfo(nodeName, podsByNode.get(nodeName)));
        }
        return new ClusterSnapshot(nodes.build(), claims.build());
    }

    static ClusterSnapshot empty() {
        return new ClusterSnapshot(ImmutableMap.of(), ImmutableSet.of());
    }

    static String namespacedName(final String namespace, final String name) {
        return namespace + "/" + name;
    }

    /**
     * Whether some pod in the snapshot uses the claim with the given namespace-qualified name.
     */
    public boolean isClaimUsedByPods(final String namespacedClaimName) {
        return claimsUsedByPods.contains(namespacedClaimName);
    }

    public List<NodeInfo> nodeInfos() {
        return ImmutableList.copyOf(nodeInfos.values());
    }

    @Nullable
    public NodeInfo nodeInfo(final String nodeName) {
        return nodeInfos.get(nodeName);
    }

    public int numNodes() {
        return nodeInfos.size();
    }
}
