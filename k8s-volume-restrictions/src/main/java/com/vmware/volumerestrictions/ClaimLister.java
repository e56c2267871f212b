/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;

/**
 * Point lookups of persistent volume claims.
 */
@FunctionalInterface
public interface ClaimLister {

    /**
     * @throws ClaimNotFoundException if no claim with that name exists in the namespace
     * @throws ClaimLookupException if the store could not answer
     */
    PersistentVolumeClaim get(String namespace, String name);
}
