/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import javax.annotation.Nullable;

/**
 * An event a plugin registers interest in, optionally refined by a hint function. Without a
 * hint, every matching event requeues the pod.
 */
public record ClusterEventWithHint(ClusterEvent event, @Nullable QueueingHintFunction queueingHintFn) {

    public ClusterEventWithHint(final ClusterEvent event) {
        this(event, null);
    }
}
