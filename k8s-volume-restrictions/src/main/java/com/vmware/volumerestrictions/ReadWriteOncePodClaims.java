/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableSet;
import com.vmware.volumerestrictions.framework.PodInfo;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimVolumeSource;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves which of a pod's claims use the ReadWriteOncePod access mode.
 */
class ReadWriteOncePodClaims {
    private static final Logger LOG = LoggerFactory.getLogger(ReadWriteOncePodClaims.class);
    static final String READ_WRITE_ONCE_POD = "ReadWriteOncePod";
    private final ClaimLister claimLister;

    ReadWriteOncePodClaims(final ClaimLister claimLister) {
        this.claimLister = claimLister;
    }

    /**
     * Returns the names of the pod's claims whose access modes contain ReadWriteOncePod. If
     * {@code ignoreNotFound} is set, claims that do not exist are skipped; otherwise the first missing
     * claim raises {@link ClaimNotFoundException}. Other lookup failures always propagate.
     */
    ImmutableSet<String> forPod(final Pod pod, final boolean ignoreNotFound) {
        final String namespace = pod.getMetadata().getNamespace();
        final ImmutableSet.Builder<String> claims = ImmutableSet.builder();
        for (final String claimName : claimNames(pod)) {
            final PersistentVolumeClaim claim;
            try {
                claim = claimLister.get(namespace, claimName);
            } catch (final ClaimNotFoundException e) {
                if (ignoreNotFound) {
                    LOG.trace("Skipping claim {}/{} of pod {}: {}", namespace, claimName,
                              pod.getMetadata().getName(), e.getMessage());
                    continue;
                }
                throw e;
            }
            if (hasReadWriteOncePodAccessMode(claim)) {
                claims.add(claimName);
            }
        }
        return claims.build();
    }

    /**
     * Names of the claims referenced by the pod's volumes, in declaration order, without resolving them.
     */
    static List<String> claimNames(final Pod pod) {
        return PodInfo.volumesOf(pod).stream()
                .map(Volume::getPersistentVolumeClaim)
                .filter(Objects::nonNull)
                .map(PersistentVolumeClaimVolumeSource::getClaimName)
                .collect(Collectors.toList());
    }

    static boolean hasReadWriteOncePodAccessMode(final PersistentVolumeClaim claim) {
        if (claim.getSpec() == null) {
            return false;
        }
        return Optional.ofNullable(claim.getSpec().getAccessModes()).orElse(Collections.emptyList())
                       .contains(READ_WRITE_ONCE_POD);
    }
}
