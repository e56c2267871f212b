/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

/**
 * Data a plugin stores in a {@link CycleState} during one scheduling attempt.
 */
public interface StateData {

    /**
     * Returns a copy that can be mutated without affecting this instance. Used when the
     * scheduler branches a cycle state to simulate preemption.
     */
    StateData copy();
}
