/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.vmware.volumerestrictions.framework.ClusterEvent;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.ADD;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.DELETE;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.UPDATE;

/**
 * Turns persistent volume claim events into cluster events. Claims themselves are not stored in
 * the database: lookups go to the informer cache through {@link InformerClaimLister}.
 */
class ClaimResourceEventHandler implements ResourceEventHandler<PersistentVolumeClaim> {
    private static final Logger LOG = LoggerFactory.getLogger(ClaimResourceEventHandler.class);
    private static final ClusterEvent CLAIM_ADDED =
            new ClusterEvent(ClusterEvent.Resource.PERSISTENT_VOLUME_CLAIM, ADD);
    private static final ClusterEvent CLAIM_UPDATED =
            new ClusterEvent(ClusterEvent.Resource.PERSISTENT_VOLUME_CLAIM, UPDATE);
    private static final ClusterEvent CLAIM_DELETED =
            new ClusterEvent(ClusterEvent.Resource.PERSISTENT_VOLUME_CLAIM, DELETE);
    private final ClusterEventListener listener;
    private final ExecutorService service;

    ClaimResourceEventHandler(final ClusterEventListener listener, final ExecutorService service) {
        this.listener = listener;
        this.service = service;
    }

    @Override
    public void onAdd(final PersistentVolumeClaim claim) {
        LOG.trace("{}/{} claim add received", claim.getMetadata().getNamespace(), claim.getMetadata().getName());
        service.execute(() -> listener.onClusterEvent(CLAIM_ADDED, null, claim));
    }

    @Override
    public void onUpdate(final PersistentVolumeClaim oldClaim, final PersistentVolumeClaim newClaim) {
        LOG.trace("{}/{} claim update received", newClaim.getMetadata().getNamespace(),
                  newClaim.getMetadata().getName());
        service.execute(() -> listener.onClusterEvent(CLAIM_UPDATED, oldClaim, newClaim));
    }

    @Override
    public void onDelete(final PersistentVolumeClaim claim, final boolean deletedFinalStateUnknown) {
        LOG.trace("{}/{} claim delete received", claim.getMetadata().getNamespace(), claim.getMetadata().getName());
        service.execute(() -> listener.onClusterEvent(CLAIM_DELETED, claim, null));
    }
}
