/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import io.fabric8.kubernetes.api.model.Pod;

import javax.annotation.Nullable;

/**
 * Decides, from the objects attached to a cluster event, whether a pod previously rejected by a
 * plugin might now be schedulable. Implementations may throw; the queue then requeues the pod.
 */
@FunctionalInterface
public interface QueueingHintFunction {

    /**
     * @param pod the pod waiting in the unschedulable pool
     * @param oldObj the object before the change, null for additions
     * @param newObj the object after the change, null for deletions
     */
    QueueingHint hint(Pod pod, @Nullable Object oldObj, @Nullable Object newObj);
}
