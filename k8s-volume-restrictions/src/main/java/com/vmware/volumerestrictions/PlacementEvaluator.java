/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vmware.volumerestrictions.framework.CycleState;
import com.vmware.volumerestrictions.framework.FilterPlugin;
import com.vmware.volumerestrictions.framework.NodeInfo;
import com.vmware.volumerestrictions.framework.PodInfo;
import com.vmware.volumerestrictions.framework.PreFilterPlugin;
import com.vmware.volumerestrictions.framework.Status;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static com.codahale.metrics.MetricRegistry.name;

/**
 * Runs scheduling attempts: PreFilter once, then Filter for every node of a snapshot
 * concurrently, and, if no node fits, a dry run of preemption.
 */
class PlacementEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(PlacementEvaluator.class);
    private final List<PreFilterPlugin> preFilterPlugins;
    private final List<FilterPlugin> filterPlugins;
    private final PreemptionSimulator preemptionSimulator;
    private final boolean preemptionEnabled;
    private final MetricRegistry metrics = new MetricRegistry();
    private final Meter attempts = metrics.meter("attempts");
    private final Meter unschedulableAttempts = metrics.meter("unschedulableAttempts");
    private final Timer evaluationTimes = metrics.timer(name(PlacementEvaluator.class, "evaluationTimes"));
    private final ThreadFactory namedThreadFactory =
            new ThreadFactoryBuilder().setNameFormat("filter-thread-%d").build();
    private final ListeningExecutorService service;

    PlacementEvaluator(final List<? extends PreFilterPlugin> preFilterPlugins,
                       final List<? extends FilterPlugin> filterPlugins,
                       final int numThreads, final boolean preemptionEnabled) {
        Preconditions.checkArgument(numThreads > 0, "numThreads has to be a positive integer");
        this.preFilterPlugins = ImmutableList.copyOf(preFilterPlugins);
        this.filterPlugins = ImmutableList.copyOf(filterPlugins);
        this.preemptionSimulator = new PreemptionSimulator(this.preFilterPlugins, this.filterPlugins);
        this.preemptionEnabled = preemptionEnabled;
        this.service = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(numThreads,
                                                                                     namedThreadFactory));
    }

    /**
     * Evaluates the pod against every node in the snapshot. The snapshot must be the one the
     * plugins read from during this attempt.
     */
    PlacementResult evaluate(final Pod pod, final ClusterSnapshot snapshot) throws InterruptedException {
        attempts.mark();
        final Timer.Context timer = evaluationTimes.time();
        try {
            final PlacementResult result = doEvaluate(pod, snapshot);
            if (!result.isSchedulable()) {
                unschedulableAttempts.mark();
            }
            return result;
        } finally {
            timer.stop();
        }
    }

    private PlacementResult doEvaluate(final Pod pod, final ClusterSnapshot snapshot) throws InterruptedException {
        final CycleState cycleState = new CycleState();
        for (final PreFilterPlugin plugin : preFilterPlugins) {
            final Status status = plugin.preFilter(cycleState, pod);
            if (status.isSuccess() || status.isSkip()) {
                continue;
            }
            LOG.info("PreFilter of plugin {} returned {} for pod {}/{}", plugin.name(), status,
                     pod.getMetadata().getNamespace(), pod.getMetadata().getName());
            final Set<String> rejectors = status.isRejected() ? ImmutableSet.of(plugin.name()) : ImmutableSet.of();
            return new PlacementResult(pod, status, ImmutableMap.of(), ImmutableList.of(), ImmutableMap.of(),
                                       rejectors);
        }

        final List<NodeInfo> nodes = snapshot.nodeInfos();
        final List<ListenableFuture<NodeVerdict>> futures = new ArrayList<>(nodes.size());
        for (final NodeInfo nodeInfo : nodes) {
            futures.add(service.submit(() -> runFilterPlugins(filterPlugins, cycleState, pod, nodeInfo)));
        }
        final List<NodeVerdict> verdicts;
        try {
            verdicts = Futures.allAsList(futures).get();
        } catch (final ExecutionException e) {
            throw new RuntimeException(e.getCause());
        }

        final Map<String, Status> nodeStatuses = new LinkedHashMap<>();
        final List<String> feasibleNodes = new ArrayList<>();
        final ImmutableSet.Builder<String> rejectors = ImmutableSet.builder();
        for (int i = 0; i < nodes.size(); i++) {
            final NodeVerdict verdict = verdicts.get(i);
            final String nodeName = nodes.get(i).name();
            nodeStatuses.put(nodeName, verdict.status());
            if (verdict.status().isSuccess()) {
                feasibleNodes.add(nodeName);
            } else if (verdict.status().isRejected() && verdict.plugin() != null) {
                rejectors.add(verdict.plugin());
            }
        }

        final Map<String, List<PodInfo>> victims = new LinkedHashMap<>();
        if (feasibleNodes.isEmpty() && preemptionEnabled) {
            for (final NodeInfo nodeInfo : nodes) {
                // Preemption cannot help where the verdict was unresolvable or an error
                if (nodeStatuses.get(nodeInfo.name()).code() != Status.Code.UNSCHEDULABLE) {
                    continue;
                }
                final Optional<List<PodInfo>> selected = preemptionSimulator.selectVictims(cycleState, pod, nodeInfo);
                selected.ifPresent(podInfos -> victims.put(nodeInfo.name(), podInfos));
            }
        }
        return new PlacementResult(pod, Status.success(), nodeStatuses, feasibleNodes, victims, rejectors.build());
    }

    /**
     * The verdict of all filter plugins on one node. {@code plugin} names the plugin that failed, if any.
     */
    record NodeVerdict(Status status, @Nullable String plugin) {
    }

    /**
     * Runs the filter plugins in order and stops at the first one that does not succeed. Plugins that
     * skipped during PreFilter are not invoked.
     */
    static NodeVerdict runFilterPlugins(final List<FilterPlugin> filterPlugins, final CycleState cycleState,
                                        final Pod pod, final NodeInfo nodeInfo) {
        for (final FilterPlugin plugin : filterPlugins) {
            if (cycleState.isFilterSkipped(plugin.name())) {
                continue;
            }
            final Status status = plugin.filter(cycleState, pod, nodeInfo);
            if (!status.isSuccess()) {
                return new NodeVerdict(status, plugin.name());
            }
        }
        return new NodeVerdict(Status.success(), null);
    }

    @VisibleForTesting
    MetricRegistry metrics() {
        return metrics;
    }

    void shutdown() throws InterruptedException {
        service.shutdownNow();
        service.awaitTermination(100, TimeUnit.SECONDS);
    }
}
