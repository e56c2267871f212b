/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import java.util.EnumSet;
import java.util.Set;

/**
 * A coarse description of a change in the cluster: which kind of resource changed and how.
 */
public record ClusterEvent(Resource resource, Set<ActionType> actionTypes) {

    public enum Resource {
        POD,
        NODE,
        PERSISTENT_VOLUME_CLAIM
    }

    public enum ActionType {
        ADD,
        UPDATE,
        DELETE
    }

    public ClusterEvent(final Resource resource, final ActionType actionType, final ActionType... more) {
        this(resource, EnumSet.of(actionType, more));
    }

    public ClusterEvent {
        actionTypes = Set.copyOf(actionTypes);
    }

    /**
     * Whether an event registered with this resource and these actions is interested in the given event.
     */
    public boolean matches(final ClusterEvent incoming) {
        return resource == incoming.resource()
                && incoming.actionTypes().stream().anyMatch(actionTypes::contains);
    }
}
