/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.collect.ImmutableList;
import io.fabric8.kubernetes.api.model.AWSElasticBlockStoreVolumeSource;
import io.fabric8.kubernetes.api.model.GCEPersistentDiskVolumeSource;
import io.fabric8.kubernetes.api.model.ISCSIVolumeSource;
import io.fabric8.kubernetes.api.model.RBDVolumeSource;
import io.fabric8.kubernetes.api.model.Volume;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The volume sources that take part in disk conflict checks. Each kind decides on its own when two
 * volumes of that kind conflict; volumes of different kinds never conflict.
 */
sealed interface ConflictVolume {

    /**
     * Whether mounting this volume next to {@code existing} on the same node is forbidden.
     */
    boolean conflictsWith(ConflictVolume existing);

    /**
     * The fabric8 volume source this descriptor was read from, under the given volume name.
     */
    Volume toVolume(String volumeName);

    /**
     * Returns the descriptor for a pod volume, or empty for volume kinds that are never checked.
     */
    static Optional<ConflictVolume> of(final Volume volume) {
        if (volume.getGcePersistentDisk() != null) {
            final GCEPersistentDiskVolumeSource source = volume.getGcePersistentDisk();
            return Optional.of(new GcePersistentDisk(source.getPdName(), isTrue(source.getReadOnly())));
        }
        if (volume.getAwsElasticBlockStore() != null) {
            return Optional.of(new AwsElasticBlockStore(volume.getAwsElasticBlockStore().getVolumeID()));
        }
        if (volume.getIscsi() != null) {
            final ISCSIVolumeSource source = volume.getIscsi();
            return Optional.of(new Iscsi(source.getIqn(), isTrue(source.getReadOnly())));
        }
        if (volume.getRbd() != null) {
            final RBDVolumeSource source = volume.getRbd();
            final List<String> monitors = Optional.ofNullable(source.getMonitors()).orElse(Collections.emptyList());
            return Optional.of(new Rbd(monitors, source.getPool(), source.getImage(), isTrue(source.getReadOnly())));
        }
        return Optional.empty();
    }

    static boolean needsRestrictionsCheck(final Volume volume) {
        return volume.getGcePersistentDisk() != null || volume.getAwsElasticBlockStore() != null
                || volume.getRbd() != null || volume.getIscsi() != null;
    }

    private static boolean isTrue(@Nullable final Boolean b) {
        return b != null && b;
    }

    /**
     * The same GCE disk mounted by multiple pods conflicts unless all pods mount it read-only.
     */
    record GcePersistentDisk(String pdName, boolean readOnly) implements ConflictVolume {

        @Override
        public boolean conflictsWith(final ConflictVolume existing) {
            return existing instanceof GcePersistentDisk other
                    && Objects.equals(pdName, other.pdName)
                    && !(readOnly && other.readOnly);
        }

        @Override
        public Volume toVolume(final String volumeName) {
            final Volume volume = new Volume();
            volume.setName(volumeName);
            final GCEPersistentDiskVolumeSource source = new GCEPersistentDiskVolumeSource();
            source.setPdName(pdName);
            source.setReadOnly(readOnly);
            volume.setGcePersistentDisk(source);
            return volume;
        }
    }

    /**
     * EBS volumes can be attached to a single instance, so any two pods sharing a volume id conflict.
     */
    record AwsElasticBlockStore(String volumeId) implements ConflictVolume {

        @Override
        public boolean conflictsWith(final ConflictVolume existing) {
            return existing instanceof AwsElasticBlockStore other
                    && Objects.equals(volumeId, other.volumeId);
        }

        @Override
        public Volume toVolume(final String volumeName) {
            final Volume volume = new Volume();
            volume.setName(volumeName);
            final AWSElasticBlockStoreVolumeSource source = new AWSElasticBlockStoreVolumeSource();
            source.setVolumeID(volumeId);
            volume.setAwsElasticBlockStore(source);
            return volume;
        }
    }

    /**
     * Two iSCSI volumes are the same if they share the same IQN. iSCSI volumes are RWO or ROX, so only
     * one read-write mount is allowed.
     */
    record Iscsi(String iqn, boolean readOnly) implements ConflictVolume {

        @Override
        public boolean conflictsWith(final ConflictVolume existing) {
            return existing instanceof Iscsi other
                    && Objects.equals(iqn, other.iqn)
                    && !(readOnly && other.readOnly);
        }

        @Override
        public Volume toVolume(final String volumeName) {
            final Volume volume = new Volume();
            volume.setName(volumeName);
            final ISCSIVolumeSource source = new ISCSIVolumeSource();
            source.setIqn(iqn);
            source.setReadOnly(readOnly);
            volume.setIscsi(source);
            return volume;
        }
    }

    /**
     * Two RBD images are the same if they share a Ceph monitor, live in the same RADOS pool and have
     * the same image name. Only one read-write mount of an image is permitted.
     */
    record Rbd(List<String> monitors, @Nullable String pool, String image, boolean readOnly)
            implements ConflictVolume {

        public Rbd {
            monitors = ImmutableList.copyOf(monitors);
        }

        @Override
        public boolean conflictsWith(final ConflictVolume existing) {
            return existing instanceof Rbd other
                    && haveOverlap(monitors, other.monitors)
                    && Objects.equals(pool, other.pool)
                    && Objects.equals(image, other.image)
                    && !(readOnly && other.readOnly);
        }

        @Override
        public Volume toVolume(final String volumeName) {
            final Volume volume = new Volume();
            volume.setName(volumeName);
            final RBDVolumeSource source = new RBDVolumeSource();
            source.setMonitors(monitors);
            source.setPool(pool);
            source.setImage(image);
            source.setReadOnly(readOnly);
            volume.setRbd(source);
            return volume;
        }
    }

    /**
     * Returns true if the two lists have at least one element in common. Builds the lookup set from
     * the shorter list.
     */
    static boolean haveOverlap(final List<String> a1, final List<String> a2) {
        final List<String> shorter = a1.size() > a2.size() ? a2 : a1;
        final List<String> longer = shorter == a1 ? a2 : a1;
        final Set<String> lookup = new HashSet<>(shorter);
        for (final String value : longer) {
            if (lookup.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
