/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vmware.volumerestrictions.framework.ClusterEvent;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.DefaultKubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.DELETE;

/**
 * Watches pending pods addressed to a scheduler and reports whether their volumes allow them to be
 * placed, and on which nodes. Pods that cannot be placed wait in a {@link SchedulingQueue} until a
 * cluster event may change the verdict. The watcher never binds or evicts pods.
 */
public final class PlacementWatcher {
    private static final Logger LOG = LoggerFactory.getLogger(PlacementWatcher.class);
    private static final ClusterEvent POD_DELETED = new ClusterEvent(ClusterEvent.Resource.POD, DELETE);
    private final String schedulerName;
    private final ClusterStateToDatabase clusterState;
    private final AtomicReference<ClusterSnapshot> currentSnapshot = new AtomicReference<>(ClusterSnapshot.empty());
    private final PlacementEvaluator evaluator;
    private final SchedulingQueue queue;
    private final ThreadFactory namedThreadFactory =
            new ThreadFactoryBuilder().setNameFormat("placement-thread-%d").build();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(namedThreadFactory);

    /**
     * Builder to instantiate a placement watcher
     */
    public static class Builder {
        static final String DEFAULT_SCHEDULER_NAME = "default-scheduler";
        private final DBConnectionPool connection;
        private final ClaimLister claimLister;
        private String schedulerName = DEFAULT_SCHEDULER_NAME;
        private int numThreads = 1;
        private boolean preemptionEnabled = true;

        Builder(final DBConnectionPool connection, final ClaimLister claimLister) {
            this.connection = connection;
            this.claimLister = claimLister;
        }

        /**
         * Only pods whose spec.schedulerName matches are evaluated. Defaults to "default-scheduler".
         */
        public Builder setSchedulerName(final String schedulerName) {
            if (schedulerName == null || schedulerName.isEmpty()) {
                throw new IllegalArgumentException("schedulerName has to be a non-empty string");
            }
            this.schedulerName = schedulerName;
            return this;
        }

        /**
         * Configure the number of threads nodes are filtered on. Defaults to 1.
         */
        public Builder setNumThreads(final int numThreads) {
            if (numThreads <= 0) {
                throw new IllegalArgumentException("numThreads has to be a positive integer");
            }
            this.numThreads = numThreads;
            return this;
        }

        /**
         * Whether to report preemption victims when a pod does not fit any node. Defaults to true.
         */
        public Builder setPreemptionEnabled(final boolean preemptionEnabled) {
            this.preemptionEnabled = preemptionEnabled;
            return this;
        }

        public PlacementWatcher build() {
            return new PlacementWatcher(connection, claimLister, schedulerName, numThreads, preemptionEnabled);
        }
    }

    private PlacementWatcher(final DBConnectionPool dbConnectionPool, final ClaimLister claimLister,
                             final String schedulerName, final int numThreads, final boolean preemptionEnabled) {
        this.schedulerName = schedulerName;
        this.clusterState = new ClusterStateToDatabase(dbConnectionPool);
        final VolumeRestrictions volumeRestrictions = new VolumeRestrictions(claimLister, currentSnapshot::get);
        this.evaluator = new PlacementEvaluator(ImmutableList.of(volumeRestrictions),
                                                ImmutableList.of(volumeRestrictions), numThreads, preemptionEnabled);
        this.queue = new SchedulingQueue(ImmutableList.of(volumeRestrictions));
        LOG.info("Initialized placement watcher: {} {} {}", schedulerName, numThreads, preemptionEnabled);
    }

    ClusterStateToDatabase clusterState() {
        return clusterState;
    }

    @VisibleForTesting
    SchedulingQueue queue() {
        return queue;
    }

    /**
     * Reflects the event in the stored state first, then updates the queue, so that an attempt
     * triggered by the event sees it.
     */
    void handlePodEvent(final PodEvent podEvent) {
        clusterState.handle(podEvent);
        final Pod pod = podEvent.pod();
        switch (podEvent.action()) {
            case ADDED -> {
                if (isPending(pod)) {
                    queue.add(pod);
                }
            }
            case UPDATED -> {
                if (isPending(pod)) {
                    // Resyncs and status-only updates leave a parked pod where it is
                    if (isPodUpdated(podEvent.oldPod(), pod)) {
                        queue.add(pod);
                    }
                } else {
                    queue.delete(pod);
                }
            }
            case DELETED -> {
                queue.delete(pod);
                if (pod.getSpec().getNodeName() != null) {
                    queue.onClusterEvent(POD_DELETED, pod, null);
                }
            }
        }
    }

    void onClusterEvent(final ClusterEvent event, @Nullable final Object oldObj, @Nullable final Object newObj) {
        queue.onClusterEvent(event, oldObj, newObj);
    }

    /**
     * Whether an update changed anything that may affect the placement of the pod.
     */
    @VisibleForTesting
    static boolean isPodUpdated(@Nullable final Pod oldPod, final Pod newPod) {
        if (oldPod == null) {
            return true;
        }
        final String oldVersion = oldPod.getMetadata().getResourceVersion();
        if (oldVersion != null && oldVersion.equals(newPod.getMetadata().getResourceVersion())) {
            return false;
        }
        return !Objects.equals(oldPod.getSpec(), newPod.getSpec())
                || !Objects.equals(oldPod.getMetadata().getLabels(), newPod.getMetadata().getLabels())
                || !Objects.equals(oldPod.getMetadata().getAnnotations(), newPod.getMetadata().getAnnotations());
    }

    private boolean isPending(final Pod pod) {
        return pod.getSpec().getNodeName() == null
                && Objects.equals(schedulerName, pod.getSpec().getSchedulerName())
                && pod.getMetadata().getDeletionTimestamp() == null;
    }

    void start() {
        worker.execute(
                () -> {
                    while (!Thread.currentThread().isInterrupted()) {
                        final Pod pod;
                        try {
                            pod = queue.take();
                        } catch (final InterruptedException e) {
                            Thread.currentThread().interrupt();
                            break;
                        }
                        try {
                            attempt(pod);
                        } catch (final InterruptedException e) {
                            Thread.currentThread().interrupt();
                            break;
                        } catch (final RuntimeException e) {
                            LOG.error("Scheduling attempt for pod {}/{} failed", pod.getMetadata().getNamespace(),
                                      pod.getMetadata().getName(), e);
                            // No plugin claimed the failure, so any event moves the pod back
                            queue.addUnschedulable(pod, ImmutableSet.of());
                        }
                    }
                }
        );
    }

    /**
     * Runs one attempt against a fresh snapshot and parks the pod if it does not fit anywhere.
     */
    @VisibleForTesting
    PlacementResult attempt(final Pod pod) throws InterruptedException {
        final ClusterSnapshot snapshot = clusterState.snapshot();
        currentSnapshot.set(snapshot);
        final PlacementResult result = evaluator.evaluate(pod, snapshot);
        if (result.isSchedulable()) {
            LOG.info("pod:{}/{} fits on nodes {}", pod.getMetadata().getNamespace(), pod.getMetadata().getName(),
                     result.feasibleNodes());
            queue.done(pod);
            return result;
        }
        if (!result.preemptionVictims().isEmpty()) {
            result.preemptionVictims().forEach((node, victims) ->
                    LOG.info("pod:{}/{} would fit on node {} if {} were preempted",
                             pod.getMetadata().getNamespace(), pod.getMetadata().getName(), node, victims));
        }
        LOG.info("pod:{}/{} could not be placed: {}", pod.getMetadata().getNamespace(), pod.getMetadata().getName(),
                 result.preFilterStatus().isSuccess() ? result.nodeStatuses() : result.preFilterStatus());
        queue.addUnschedulable(pod, result.rejectorPlugins());
        return result;
    }

    void shutdown() throws InterruptedException {
        worker.shutdownNow();
        worker.awaitTermination(100, TimeUnit.SECONDS);
        evaluator.shutdown();
    }

    public static void main(final String[] args) throws InterruptedException, ParseException {
        final Options options = new Options();
        options.addOption("s", "scheduler-name", true,
                "Only consider pods with this spec.schedulerName");
        options.addOption("t", "num-threads", true,
                "Number of threads to filter nodes with");
        options.addOption("r", "resync-period-ms", true,
                "Resync period of the informers");
        options.addOption("np", "disable-preemption", false,
                "Do not report preemption victims for pods that do not fit");
        final CommandLineParser parser = new DefaultParser();
        final CommandLine cmd = parser.parse(options, args);

        final KubernetesClient kubernetesClient = new DefaultKubernetesClient();
        LOG.info("Watching pod placements on a Kubernetes cluster on {}",
                 kubernetesClient.getConfiguration().getMasterUrl());
        final KubernetesStateSync stateSync = new KubernetesStateSync(kubernetesClient,
                Long.parseLong(cmd.getOptionValue("resync-period-ms", "30000")));

        final DBConnectionPool conn = new DBConnectionPool();
        final PlacementWatcher watcher = new PlacementWatcher.Builder(conn, stateSync.claimLister())
                .setSchedulerName(cmd.getOptionValue("scheduler-name", Builder.DEFAULT_SCHEDULER_NAME))
                .setNumThreads(Integer.parseInt(cmd.getOptionValue("num-threads", "1")))
                .setPreemptionEnabled(!cmd.hasOption("disable-preemption"))
                .build();
        stateSync.setupInformersAndEventStreams(watcher.clusterState(), watcher::handlePodEvent,
                                                watcher::onClusterEvent);
        watcher.start();
        stateSync.startProcessingEvents();
        Thread.currentThread().join();
    }
}
