/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import java.util.List;

/**
 * Implemented by plugins that can tell which cluster events may make a pod they rejected schedulable.
 */
public interface EnqueueExtensions extends Plugin {
    List<ClusterEventWithHint> eventsToRegister();
}
