/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import io.fabric8.kubernetes.api.model.Pod;

import javax.annotation.Nullable;

record PodEvent(Action action, Pod pod, @Nullable Pod oldPod) {

    PodEvent(final Action action, final Pod pod) {
        this(action, pod, null);
    }

    enum Action {
        ADDED,
        UPDATED,
        DELETED
    }

    @Override
    public String toString() {
        return "PodEvent{" +
                "action=" + action.name() +
                ", pod=" + pod.getMetadata().getName() +
                '}';
    }
}
