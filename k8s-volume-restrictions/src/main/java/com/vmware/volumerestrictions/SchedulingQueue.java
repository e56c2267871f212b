/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.vmware.volumerestrictions.framework.ClusterEvent;
import com.vmware.volumerestrictions.framework.ClusterEventWithHint;
import com.vmware.volumerestrictions.framework.EnqueueExtensions;
import com.vmware.volumerestrictions.framework.QueueingHint;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * Holds pods waiting for a scheduling attempt. Pods that were rejected are parked until a cluster
 * event arrives that, according to the queueing hints of the plugins that rejected them, may
 * make them schedulable.
 */
class SchedulingQueue implements ClusterEventListener {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulingQueue.class);
    private final ImmutableListMultimap<String, ClusterEventWithHint> hintsByPlugin;
    private final LinkedBlockingDeque<String> activeQ = new LinkedBlockingDeque<>();
    private final Map<String, Pod> activePods = new HashMap<>();
    private final Map<String, UnschedulablePod> unschedulablePods = new LinkedHashMap<>();
    // Events received while a pod is being attempted, keyed by pod uid
    private final Map<String, List<ReceivedEvent>> inFlightEvents = new HashMap<>();
    private final Object lock = new Object();

    private record UnschedulablePod(Pod pod, Set<String> rejectorPlugins) {
    }

    private record ReceivedEvent(ClusterEvent event, @Nullable Object oldObj, @Nullable Object newObj) {
    }

    SchedulingQueue(final List<? extends EnqueueExtensions> plugins) {
        final ImmutableListMultimap.Builder<String, ClusterEventWithHint> builder = ImmutableListMultimap.builder();
        for (final EnqueueExtensions plugin : plugins) {
            builder.putAll(plugin.name(), plugin.eventsToRegister());
        }
        this.hintsByPlugin = builder.build();
    }

    /**
     * Adds a pod to the active queue. If it is already there, the queued version is replaced.
     */
    void add(final Pod pod) {
        synchronized (lock) {
            final String uid = pod.getMetadata().getUid();
            unschedulablePods.remove(uid);
            if (activePods.put(uid, pod) == null) {
                activeQ.add(uid);
            }
        }
    }

    /**
     * Blocks until a pod is available for a scheduling attempt. The pod stays in flight until
     * {@link #addUnschedulable} or {@link #done} is called for it, and cluster events received in the
     * meantime are kept for it.
     */
    Pod take() throws InterruptedException {
        while (true) {
            final String uid = activeQ.take();
            synchronized (lock) {
                // The pod may have been deleted while it was waiting
                final Pod pod = activePods.remove(uid);
                if (pod != null) {
                    inFlightEvents.put(uid, new ArrayList<>());
                    return pod;
                }
            }
        }
    }

    /**
     * Parks a pod after a failed attempt. {@code rejectorPlugins} are the plugins whose verdict made
     * the attempt fail; only their hints are consulted for this pod. A pod without rejectors failed
     * for reasons no plugin claimed, and is moved back on any event.
     *
     * Events received while the attempt was running are replayed against the rejectors' hints first.
     * If one of them may make the pod schedulable, the pod goes straight back to the active queue.
     */
    void addUnschedulable(final Pod pod, final Set<String> rejectorPlugins) {
        final String uid = pod.getMetadata().getUid();
        final UnschedulablePod unschedulablePod = new UnschedulablePod(pod, ImmutableSet.copyOf(rejectorPlugins));
        boolean requeue = false;
        while (true) {
            final List<ReceivedEvent> received;
            synchronized (lock) {
                if (activePods.containsKey(uid)) {
                    // A newer version of the pod was added while the attempt was running
                    inFlightEvents.remove(uid);
                    return;
                }
                final List<ReceivedEvent> pending = inFlightEvents.get(uid);
                if (requeue || pending == null || pending.isEmpty()) {
                    inFlightEvents.remove(uid);
                    if (requeue) {
                        activePods.put(uid, pod);
                        activeQ.add(uid);
                    } else {
                        unschedulablePods.put(uid, unschedulablePod);
                    }
                    break;
                }
                received = ImmutableList.copyOf(pending);
                pending.clear();
            }
            // Hints run outside the lock. Events arriving meanwhile are picked up by the next round.
            for (final ReceivedEvent event : received) {
                if (isQueueable(unschedulablePod, event.event(), event.oldObj(), event.newObj())) {
                    requeue = true;
                    break;
                }
            }
        }
        if (requeue) {
            LOG.info("Pod {}/{} was rejected by {}, but an event received during the attempt may make it "
                     + "schedulable. Requeueing it", pod.getMetadata().getNamespace(), pod.getMetadata().getName(),
                     rejectorPlugins);
        } else {
            LOG.debug("Pod {}/{} is unschedulable, rejected by {}", pod.getMetadata().getNamespace(),
                      pod.getMetadata().getName(), rejectorPlugins);
        }
    }

    /**
     * Ends the attempt of a pod that was not parked.
     */
    void done(final Pod pod) {
        synchronized (lock) {
            inFlightEvents.remove(pod.getMetadata().getUid());
        }
    }

    /**
     * Forgets a pod, for instance because it was deleted or bound elsewhere.
     */
    void delete(final Pod pod) {
        synchronized (lock) {
            final String uid = pod.getMetadata().getUid();
            unschedulablePods.remove(uid);
            activePods.remove(uid);
            inFlightEvents.remove(uid);
        }
    }

    @Override
    public void onClusterEvent(final ClusterEvent event, @Nullable final Object oldObj,
                               @Nullable final Object newObj) {
        moveOnEvent(event, oldObj, newObj);
    }

    /**
     * Runs the hints registered for this event against every parked pod, and moves the pods that
     * may now be schedulable to the active queue. Returns the pods that were moved. The event is also
     * kept for the pods currently being attempted.
     */
    @VisibleForTesting
    List<Pod> moveOnEvent(final ClusterEvent event, @Nullable final Object oldObj, @Nullable final Object newObj) {
        final List<UnschedulablePod> candidates;
        synchronized (lock) {
            final ReceivedEvent received = new ReceivedEvent(event, oldObj, newObj);
            inFlightEvents.values().forEach(events -> events.add(received));
            candidates = ImmutableList.copyOf(unschedulablePods.values());
        }
        final List<Pod> moved = new ArrayList<>();
        for (final UnschedulablePod candidate : candidates) {
            if (isQueueable(candidate, event, oldObj, newObj)) {
                moved.add(candidate.pod());
            }
        }
        synchronized (lock) {
            final Iterator<Pod> it = moved.iterator();
            while (it.hasNext()) {
                final Pod pod = it.next();
                final String uid = pod.getMetadata().getUid();
                // Skip pods deleted or re-added while hints were running
                if (unschedulablePods.remove(uid) == null) {
                    it.remove();
                    continue;
                }
                if (activePods.put(uid, pod) == null) {
                    activeQ.add(uid);
                }
            }
        }
        if (!moved.isEmpty()) {
            LOG.info("Moved {} pod(s) to the active queue on {}", moved.size(), event);
        }
        return moved;
    }

    private boolean isQueueable(final UnschedulablePod candidate, final ClusterEvent event,
                                @Nullable final Object oldObj, @Nullable final Object newObj) {
        if (candidate.rejectorPlugins().isEmpty()) {
            return true;
        }
        for (final String plugin : candidate.rejectorPlugins()) {
            for (final ClusterEventWithHint registration : hintsByPlugin.get(plugin)) {
                if (!registration.event().matches(event)) {
                    continue;
                }
                if (registration.queueingHintFn() == null) {
                    return true;
                }
                final QueueingHint hint;
                try {
                    hint = registration.queueingHintFn().hint(candidate.pod(), oldObj, newObj);
                } catch (final RuntimeException e) {
                    LOG.error("Queueing hint of plugin {} failed for pod {}/{} on {}. Requeueing the pod",
                              plugin, candidate.pod().getMetadata().getNamespace(),
                              candidate.pod().getMetadata().getName(), event, e);
                    return true;
                }
                if (hint == QueueingHint.QUEUE) {
                    return true;
                }
            }
        }
        return false;
    }

    @VisibleForTesting
    int numActive() {
        synchronized (lock) {
            return activePods.size();
        }
    }

    @VisibleForTesting
    int numInFlight() {
        synchronized (lock) {
            return inFlightEvents.size();
        }
    }

    @VisibleForTesting
    int numUnschedulable() {
        synchronized (lock) {
            return unschedulablePods.size();
        }
    }
}
