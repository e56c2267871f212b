/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.base.Preconditions;
import com.vmware.volumerestrictions.framework.ClusterEvent;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;

import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.ADD;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.DELETE;
import static com.vmware.volumerestrictions.framework.ClusterEvent.ActionType.UPDATE;


/**
 * Subscribes to Kubernetes node events, reflects them in the database and then notifies
 * listeners, so that a listener always sees the node in the next snapshot it takes.
 */
class NodeResourceEventHandler implements ResourceEventHandler<Node> {
    private static final Logger LOG = LoggerFactory.getLogger(NodeResourceEventHandler.class);
    private final ClusterStateToDatabase clusterState;
    private final ClusterEventListener listener;
    private final ExecutorService service;

    NodeResourceEventHandler(final ClusterStateToDatabase clusterState, final ClusterEventListener listener,
                             final ExecutorService service) {
        this.clusterState = clusterState;
        this.listener = listener;
        this.service = service;
    }

    @Override
    public void onAdd(final Node node) {
        service.execute(() -> onAddSync(node));
    }

    @Override
    public void onUpdate(final Node oldNode, final Node newNode) {
        service.execute(() -> onUpdateSync(oldNode, newNode));
    }

    @Override
    public void onDelete(final Node node, final boolean deletedFinalStateUnknown) {
        service.execute(() -> onDeleteSync(node, deletedFinalStateUnknown));
    }

    public void onAddSync(final Node node) {
        clusterState.addNode(node);
        listener.onClusterEvent(new ClusterEvent(ClusterEvent.Resource.NODE, ADD), null, node);
    }

    public void onUpdateSync(final Node oldNode, final Node newNode) {
        Preconditions.checkArgument(newNode.getMetadata().getName().equals(oldNode.getMetadata().getName()));
        if (!Objects.equals(oldNode.getMetadata().getUid(), newNode.getMetadata().getUid())) {
            clusterState.addNode(newNode);
        }
        LOG.trace("{} node update received", newNode.getMetadata().getName());
        listener.onClusterEvent(new ClusterEvent(ClusterEvent.Resource.NODE, UPDATE), oldNode, newNode);
    }

    public void onDeleteSync(final Node node, final boolean deletedFinalStateUnknown) {
        clusterState.deleteNode(node);
        listener.onClusterEvent(new ClusterEvent(ClusterEvent.Resource.NODE, DELETE), node, null);
    }
}
