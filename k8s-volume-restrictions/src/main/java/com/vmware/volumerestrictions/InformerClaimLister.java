/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.fabric8.kubernetes.client.informers.cache.Lister;

/**
 * Serves claim lookups from the local cache of a shared informer. Lookups never go to the API
 * server, so a claim created moments ago may not be visible yet.
 */
class InformerClaimLister implements ClaimLister {
    private final Lister<PersistentVolumeClaim> lister;

    InformerClaimLister(final SharedIndexInformer<PersistentVolumeClaim> informer) {
        this.lister = new Lister<>(informer.getIndexer());
    }

    @Override
    public PersistentVolumeClaim get(final String namespace, final String name) {
        final PersistentVolumeClaim claim;
        try {
            claim = lister.namespace(namespace).get(name);
        } catch (final KubernetesClientException | IllegalArgumentException e) {
            throw new ClaimLookupException(String.format("failed to look up persistentvolumeclaim %s/%s",
                                                         namespace, name), e);
        }
        if (claim == null) {
            throw new ClaimNotFoundException(namespace, name);
        }
        return claim;
    }
}
