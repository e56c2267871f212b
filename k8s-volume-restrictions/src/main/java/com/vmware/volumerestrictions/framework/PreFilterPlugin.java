/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import io.fabric8.kubernetes.api.model.Pod;

import javax.annotation.Nullable;

/**
 * Invoked once per scheduling attempt, before any node is filtered.
 */
public interface PreFilterPlugin extends Plugin {

    /**
     * Precomputes state for the Filter phase. A {@link Status.Code#SKIP} result means that Filter
     * must not be invoked for this pod during this attempt.
     */
    Status preFilter(CycleState cycleState, Pod pod);

    /**
     * Hooks used to keep the precomputed state current when pods are hypothetically added to or
     * removed from a node, or null if the plugin keeps no such state.
     */
    @Nullable
    PreFilterExtensions preFilterExtensions();
}
