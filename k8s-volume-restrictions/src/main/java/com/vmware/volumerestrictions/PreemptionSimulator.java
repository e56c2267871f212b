/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableList;
import com.vmware.volumerestrictions.framework.CycleState;
import com.vmware.volumerestrictions.framework.FilterPlugin;
import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.PreFilterExtensions;
import com.vmware.volumerestrictions.framework.PreFilterPlugin;
import com.vmware.volumerestrictions.framework.Status;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds which pods on a node would have to be evicted for a higher priority pod to fit. Works on a
 * copy of the cycle state and never touches the cluster.
 */
class PreemptionSimulator {
    private static final Logger LOG = LoggerFactory.getLogger(PreemptionSimulator.class);
    private final List<PreFilterPlugin> preFilterPlugins;
    private final List<FilterPlugin> filterPlugins;

    PreemptionSimulator(final List<PreFilterPlugin> preFilterPlugins, final List<FilterPlugin> filterPlugins) {
        this.preFilterPlugins = ImmutableList.copyOf(preFilterPlugins);
        this.filterPlugins = ImmutableList.copyOf(filterPlugins);
    }

    /**
     * Removes every pod of lower priority than {@code pod} from the node. If the pod then fits, the
     * removed pods are added back one at a time, highest priority first, keeping each one that does
     * not make the pod unschedulable again. Returns the pods that could not be kept, or empty if
     * evicting all of them would still not make room.
     */
    Optional<List<PodInfo>> selectVictims(final CycleState cycleState, final Pod pod, final NodeInfo nodeInfo) {
        final CycleState state = cycleState.copy();
        final int priority = PodInfo.priorityOf(pod);
        final List<PodInfo> potentialVictims = nodeInfo.pods().stream()
                .filter(p -> p.priority() < priority)
                .sorted(Comparator.comparingInt(PodInfo::priority).reversed())
                .collect(Collectors.toList());
        if (potentialVictims.isEmpty()) {
            return Optional.empty();
        }

        NodeInfo node = nodeInfo;
        for (final PodInfo victim : potentialVictims) {
            node = node.withoutPod(victim);
            if (!removePod(state, pod, victim, node)) {
                return Optional.empty();
            }
        }
        if (!fits(state, pod, node)) {
            LOG.debug("Pod {} does not fit node {} even without {} lower priority pods",
                      pod.getMetadata().getName(), nodeInfo.name(), potentialVictims.size());
            return Optional.empty();
        }

        final List<PodInfo> victims = new ArrayList<>();
        for (final PodInfo candidate : potentialVictims) {
            final NodeInfo withCandidate = node.withPod(candidate);
            if (!addPod(state, pod, candidate, withCandidate)) {
                return Optional.empty();
            }
            if (fits(state, pod, withCandidate)) {
                node = withCandidate;
                continue;
            }
            if (!removePod(state, pod, candidate, node)) {
                return Optional.empty();
            }
            victims.add(candidate);
        }
        LOG.debug("Pod {} fits node {} if {} are evicted", pod.getMetadata().getName(), nodeInfo.name(), victims);
        return Optional.of(victims);
    }

    private boolean fits(final CycleState state, final Pod pod, final NodeInfo node) {
        return PlacementEvaluator.runFilterPlugins(filterPlugins, state, pod, node).status().isSuccess();
    }

    private boolean addPod(final CycleState state, final Pod pod, final PodInfo podInfo, final NodeInfo node) {
        for (final PreFilterPlugin plugin : preFilterPlugins) {
            final PreFilterExtensions extensions = plugin.preFilterExtensions();
            if (extensions == null) {
                continue;
            }
            final Status status = extensions.addPod(state, pod, podInfo, node);
            if (!status.isSuccess()) {
                LOG.warn("AddPod of plugin {} failed for {}: {}", plugin.name(), podInfo, status);
                return false;
            }
        }
        return true;
    }

    private boolean removePod(final CycleState state, final Pod pod, final PodInfo podInfo, final NodeInfo node) {
        for (final PreFilterPlugin plugin : preFilterPlugins) {
            final PreFilterExtensions extensions = plugin.preFilterExtensions();
            if (extensions == null) {
                continue;
            }
            final Status status = extensions.removePod(state, pod, podInfo, node);
            if (!status.isSuccess()) {
                LOG.warn("RemovePod of plugin {} failed for {}: {}", plugin.name(), podInfo, status);
                return false;
            }
        }
        return true;
    }
}
