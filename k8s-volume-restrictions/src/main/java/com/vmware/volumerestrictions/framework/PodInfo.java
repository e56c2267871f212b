/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Volume;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A pod as seen by the plugins: either a pod already assigned to a node in the snapshot, or a pod
 * being hypothetically added or removed during preemption.
 */
public record PodInfo(Pod pod) {

    public String uid() {
        return pod.getMetadata().getUid();
    }

    public String name() {
        return pod.getMetadata().getName();
    }

    public String namespace() {
        return pod.getMetadata().getNamespace();
    }

    @Nullable
    public String nodeName() {
        return pod.getSpec().getNodeName();
    }

    public int priority() {
        return priorityOf(pod);
    }

    public List<Volume> volumes() {
        return volumesOf(pod);
    }

    public static int priorityOf(final Pod pod) {
        final Integer priority = pod.getSpec().getPriority();
        return priority == null ? 0 : priority;
    }

    public static List<Volume> volumesOf(final Pod pod) {
        return Optional.ofNullable(pod.getSpec().getVolumes()).orElse(Collections.emptyList());
    }

    @Override
    public String toString() {
        return "PodInfo{" + namespace() + "/" + name() + " (uid: " + uid() + ")}";
    }
}
