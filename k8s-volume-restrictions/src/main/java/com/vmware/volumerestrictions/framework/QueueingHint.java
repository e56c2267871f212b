/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

/**
 * Tells the scheduling queue whether an event may have made a rejected pod schedulable.
 */
public enum QueueingHint {
    QUEUE,
    QUEUE_SKIP
}
