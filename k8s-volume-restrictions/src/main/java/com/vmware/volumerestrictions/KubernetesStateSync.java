/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */


package com.vmware.volumerestrictions;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.fabric8.kubernetes.client.informers.SharedInformerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;

/**
 * Wires shared informers for nodes, pods and persistent volume claims.
 */
class KubernetesStateSync {
    private static final Logger LOG = LoggerFactory.getLogger(KubernetesStateSync.class);
    private final SharedInformerFactory sharedInformerFactory;
    private final long resyncPeriodMs;
    private final ThreadFactory namedThreadFactory =
            new ThreadFactoryBuilder().setNameFormat("informer-event-thread-%d").build();
    // A single thread keeps events in the order the informers delivered them
    private final ExecutorService service = Executors.newSingleThreadExecutor(namedThreadFactory);
    private final SharedIndexInformer<PersistentVolumeClaim> claimInformer;

    KubernetesStateSync(final KubernetesClient client, final long resyncPeriodMs) {
        this.sharedInformerFactory = client.informers();
        this.resyncPeriodMs = resyncPeriodMs;
        this.claimInformer = sharedInformerFactory.sharedIndexInformerFor(PersistentVolumeClaim.class,
                                                                          resyncPeriodMs);
    }

    /**
     * The claim store backed by the claim informer's cache. Empty until the informers are started.
     */
    ClaimLister claimLister() {
        return new InformerClaimLister(claimInformer);
    }

    void setupInformersAndEventStreams(final ClusterStateToDatabase clusterState,
                                       final Consumer<PodEvent> podEventNotification,
                                       final ClusterEventListener listener) {
        final SharedIndexInformer<Node> nodeSharedIndexInformer = sharedInformerFactory
                .sharedIndexInformerFor(Node.class, resyncPeriodMs);
        nodeSharedIndexInformer.addEventHandler(new NodeResourceEventHandler(clusterState, listener, service));

        final SharedIndexInformer<Pod> podInformer = sharedInformerFactory
                .sharedIndexInformerFor(Pod.class, resyncPeriodMs);
        podInformer.addEventHandler(new PodResourceEventHandler(podEventNotification, service));

        claimInformer.addEventHandler(new ClaimResourceEventHandler(listener, service));
        LOG.info("Instantiated node, pod and persistentvolumeclaim informers. Starting them all now.");
    }

    void startProcessingEvents() {
        try {
            sharedInformerFactory.startAllRegisteredInformers().get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (final ExecutionException e) {
            throw new RuntimeException(e);
        }
    }

    void shutdown() {
        sharedInformerFactory.stopAllRegisteredInformers();
        service.shutdownNow();
    }
}
