/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Subscribes to Kubernetes pod events and hands them to a consumer. Unlike the
 * NodeResourceEventHandler, it does not write to the database itself: the consumer decides
 * how a pod event affects both the stored state and the scheduling queue.
 */
class PodResourceEventHandler implements ResourceEventHandler<Pod> {
    private static final Logger LOG = LoggerFactory.getLogger(PodResourceEventHandler.class);
    private final Consumer<PodEvent> podEventNotification;
    private final ExecutorService service;

    PodResourceEventHandler(final Consumer<PodEvent> podEventNotification, final ExecutorService service) {
        this.podEventNotification = podEventNotification;
        this.service = service;
    }

    public void onAddSync(final Pod pod) {
        LOG.trace("{} (uid: {}) pod add received", pod.getMetadata().getName(), pod.getMetadata().getUid());
        podEventNotification.accept(new PodEvent(PodEvent.Action.ADDED, pod));
    }

    public void onUpdateSync(final Pod oldPod, final Pod newPod) {
        LOG.trace("{} => {} (uid: {}) pod update received", oldPod.getMetadata().getName(),
                  newPod.getMetadata().getName(), newPod.getMetadata().getUid());
        podEventNotification.accept(new PodEvent(PodEvent.Action.UPDATED, newPod, oldPod));
    }

    public void onDeleteSync(final Pod pod, final boolean deletedFinalStateUnknown) {
        LOG.trace("{} (uid: {}) pod delete received (final state unknown: {})", pod.getMetadata().getName(),
                  pod.getMetadata().getUid(), deletedFinalStateUnknown);
        podEventNotification.accept(new PodEvent(PodEvent.Action.DELETED, pod));
    }

    @Override
    public void onAdd(final Pod pod) {
        service.execute(() -> onAddSync(pod));
    }

    @Override
    public void onUpdate(final Pod oldPod, final Pod newPod) {
        service.execute(() -> onUpdateSync(oldPod, newPod));
    }

    @Override
    public void onDelete(final Pod pod, final boolean deletedFinalStateUnknown) {
        service.execute(() -> onDeleteSync(pod, deletedFinalStateUnknown));
    }
}
