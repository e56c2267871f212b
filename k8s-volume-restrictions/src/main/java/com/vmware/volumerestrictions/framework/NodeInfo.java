/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import com.google.common.collect.ImmutableList;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A node and the pods currently assigned to it. Instances are immutable; preemption simulation
 * derives new instances through {@link #withPod} and {@link #withoutPod}.
 */
public final class NodeInfo {
    private static final String SYNTHETIC_NODE_NAME = "";
    private final String name;
    private final ImmutableList<PodInfo> pods;

    public NodeInfo(final String name, final List<PodInfo> pods) {
        this.name = Objects.requireNonNull(name);
        this.pods = ImmutableList.copyOf(pods);
    }

    /**
     * A node that exists only to hold the given pods, used to replay volume conflicts against
     * pods that are no longer part of the cluster.
     */
    public static NodeInfo forPods(final Pod... pods) {
        return new NodeInfo(SYNTHETIC_NODE_NAME, Arrays.stream(pods).map(PodInfo::new).collect(Collectors.toList()));
    }

    public String name() {
        return name;
    }

    public List<PodInfo> pods() {
        return pods;
    }

    public NodeInfo withPod(final PodInfo podInfo) {
        return new NodeInfo(name, ImmutableList.<PodInfo>builder().addAll(pods).add(podInfo).build());
    }

    public NodeInfo withoutPod(final PodInfo podInfo) {
        return new NodeInfo(name, pods.stream().filter(p -> !p.uid().equals(podInfo.uid()))
                                      .collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return "NodeInfo{" +
                "name=" + name +
                ", pods=" + pods +
                '}';
    }
}
