/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.vmware.volumerestrictions.framework.PodInfo;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimVolumeSource;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.Volume;
import org.jooq.DSLContext;
import org.jooq.Query;
import org.jooq.Record;
import org.jooq.Record3;
import org.jooq.Record4;
import org.jooq.Record5;
import org.jooq.Record7;
import org.jooq.Result;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import static com.vmware.volumerestrictions.ClusterStateTables.CLAIM_NAME;
import static com.vmware.volumerestrictions.ClusterStateTables.KIND;
import static com.vmware.volumerestrictions.ClusterStateTables.MONITOR;
import static com.vmware.volumerestrictions.ClusterStateTables.MONITOR_INDEX;
import static com.vmware.volumerestrictions.ClusterStateTables.NAMESPACE;
import static com.vmware.volumerestrictions.ClusterStateTables.NODE_INFO;
import static com.vmware.volumerestrictions.ClusterStateTables.NODE_NAME;
import static com.vmware.volumerestrictions.ClusterStateTables.NODE_UID;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_CLAIMS;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_CONFLICT_VOLUMES;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_INFO;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_NAME;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_NODE_NAME;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_RBD_MONITORS;
import static com.vmware.volumerestrictions.ClusterStateTables.POD_UID;
import static com.vmware.volumerestrictions.ClusterStateTables.POOL;
import static com.vmware.volumerestrictions.ClusterStateTables.PRIORITY;
import static com.vmware.volumerestrictions.ClusterStateTables.READ_ONLY;
import static com.vmware.volumerestrictions.ClusterStateTables.RESOURCE_VERSION;
import static com.vmware.volumerestrictions.ClusterStateTables.UID;
import static com.vmware.volumerestrictions.ClusterStateTables.VOLUME_INDEX;
import static com.vmware.volumerestrictions.ClusterStateTables.VOLUME_KEY;
import static com.vmware.volumerestrictions.ClusterStateTables.VOLUME_NAME;

/**
 * Reflects pod and node events from the Kubernetes API into the database, and takes the
 * per-cycle {@link ClusterSnapshot} from it. Only the parts of a pod that volume checks
 * look at are stored.
 */
class ClusterStateToDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(ClusterStateToDatabase.class);
    private static final long UNKNOWN_RESOURCE_VERSION = 0;
    private final DBConnectionPool dbConnectionPool;
    private final Cache<String, Boolean> deletedUids = CacheBuilder.newBuilder()
                                                                      .expireAfterWrite(5, TimeUnit.MINUTES)
                                                                      .build();

    private enum Kind {
        GCE_PERSISTENT_DISK,
        AWS_ELASTIC_BLOCK_STORE,
        ISCSI,
        RBD
    }

    ClusterStateToDatabase(final DBConnectionPool dbConnectionPool) {
        this.dbConnectionPool = dbConnectionPool;
    }

    PodEvent handle(final PodEvent event) {
        final List<Query> queries = switch (event.action()) {
            case ADDED -> addPod(event.pod());
            case UPDATED -> updatePod(event.pod(), Objects.requireNonNull(event.oldPod()));
            case DELETED -> deletePod(event.pod());
        };
        if (!queries.isEmpty()) {
            final long now = System.nanoTime();
            final DSLContext conn = dbConnectionPool.getConnectionToDb();
            conn.batch(queries).execute();
            LOG.debug("Applied {} queries for {} in {}ns", queries.size(), event, System.nanoTime() - now);
        }
        return event;
    }

    private List<Query> addPod(final Pod pod) {
        LOG.debug("Adding pod {} (uid: {}, resourceVersion: {})",
                  pod.getMetadata().getName(), pod.getMetadata().getUid(), pod.getMetadata().getResourceVersion());
        if (pod.getMetadata().getUid() != null &&
            deletedUids.getIfPresent(pod.getMetadata().getUid()) != null) {
            LOG.trace("Received stale event for pod that we already deleted: {} (uid: {}, resourceVersion {}). " +
                      "Ignoring", pod.getMetadata().getName(), pod.getMetadata().getUid(),
                      pod.getMetadata().getResourceVersion());
            return Collections.emptyList();
        }
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        final List<Query> inserts = new ArrayList<>();
        inserts.add(conn.deleteFrom(POD_INFO).where(UID.eq(pod.getMetadata().getUid())));
        inserts.addAll(insertPodRecords(pod, conn));
        return inserts;
    }

    private List<Query> updatePod(final Pod pod, final Pod oldPod) {
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        final Long existingResourceVersion = conn.select(RESOURCE_VERSION)
                .from(POD_INFO)
                .where(UID.eq(pod.getMetadata().getUid()))
                .fetchOne(RESOURCE_VERSION);
        if (existingResourceVersion == null) {
            LOG.trace("Pod {} (uid: {}) does not exist. Adding it",
                      pod.getMetadata().getName(), pod.getMetadata().getUid());
            return addPod(pod);
        }
        final long incomingResourceVersion = resourceVersion(pod);
        if (incomingResourceVersion != UNKNOWN_RESOURCE_VERSION
                && existingResourceVersion >= incomingResourceVersion) {
            LOG.trace("Received a stale pod event {} (uid: {}, resourceVersion: {}). Ignoring",
                      pod.getMetadata().getName(), pod.getMetadata().getUid(),
                      pod.getMetadata().getResourceVersion());
            return Collections.emptyList();
        }
        LOG.debug("Updating pod {} (uid: {}, node: {} => {})", pod.getMetadata().getName(),
                  pod.getMetadata().getUid(), oldPod.getSpec().getNodeName(), pod.getSpec().getNodeName());
        final List<Query> queries = new ArrayList<>();
        // Dependent rows go away through the delete cascade
        queries.add(conn.deleteFrom(POD_INFO).where(UID.eq(pod.getMetadata().getUid())));
        queries.addAll(insertPodRecords(pod, conn));
        return queries;
    }

    private List<Query> deletePod(final Pod pod) {
        LOG.debug("Deleting pod {} (uid: {}, resourceVersion: {})",
                  pod.getMetadata().getName(), pod.getMetadata().getUid(), pod.getMetadata().getResourceVersion());
        if (pod.getMetadata().getUid() != null &&
                deletedUids.getIfPresent(pod.getMetadata().getUid()) == null) {
            deletedUids.put(pod.getMetadata().getUid(), true);
        }
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        return List.of(conn.deleteFrom(POD_INFO).where(UID.eq(pod.getMetadata().getUid())));
    }

    private List<Query> insertPodRecords(final Pod pod, final DSLContext conn) {
        final String uid = pod.getMetadata().getUid();
        final List<Query> inserts = new ArrayList<>();
        inserts.add(conn.insertInto(POD_INFO, UID, POD_NAME, NAMESPACE, POD_NODE_NAME, PRIORITY, RESOURCE_VERSION)
                        .values(uid, pod.getMetadata().getName(), pod.getMetadata().getNamespace(),
                                pod.getSpec().getNodeName(), PodInfo.priorityOf(pod), resourceVersion(pod)));
        final List<Volume> volumes = PodInfo.volumesOf(pod);
        for (int i = 0; i < volumes.size(); i++) {
            final Volume volume = volumes.get(i);
            if (volume.getPersistentVolumeClaim() != null) {
                inserts.add(conn.insertInto(POD_CLAIMS, POD_UID, VOLUME_INDEX, VOLUME_NAME, CLAIM_NAME)
                                .values(uid, i, volume.getName(), volume.getPersistentVolumeClaim().getClaimName()));
                continue;
            }
            final Optional<ConflictVolume> conflictVolume = ConflictVolume.of(volume);
            if (conflictVolume.isPresent()) {
                inserts.addAll(insertConflictVolume(conn, uid, i, volume.getName(), conflictVolume.get()));
            }
        }
        return inserts;
    }

    private List<Query> insertConflictVolume(final DSLContext conn, final String uid, final int index,
                                             final String volumeName, final ConflictVolume volume) {
        final List<Query> inserts = new ArrayList<>();
        final Kind kind;
        final String key;
        String pool = null;
        boolean readOnly = false;
        if (volume instanceof ConflictVolume.GcePersistentDisk gce) {
            kind = Kind.GCE_PERSISTENT_DISK;
            key = gce.pdName();
            readOnly = gce.readOnly();
        } else if (volume instanceof ConflictVolume.AwsElasticBlockStore ebs) {
            kind = Kind.AWS_ELASTIC_BLOCK_STORE;
            key = ebs.volumeId();
        } else if (volume instanceof ConflictVolume.Iscsi iscsi) {
            kind = Kind.ISCSI;
            key = iscsi.iqn();
            readOnly = iscsi.readOnly();
        } else if (volume instanceof ConflictVolume.Rbd rbd) {
            kind = Kind.RBD;
            key = rbd.image();
            pool = rbd.pool();
            readOnly = rbd.readOnly();
        } else {
            throw new IllegalStateException("Unknown volume kind " + volume);
        }
        inserts.add(conn.insertInto(POD_CONFLICT_VOLUMES, POD_UID, VOLUME_INDEX, VOLUME_NAME, KIND, VOLUME_KEY,
                                    POOL, READ_ONLY)
                        .values(uid, index, volumeName, kind.name(), key, pool, readOnly));
        if (volume instanceof ConflictVolume.Rbd rbd) {
            // One row per monitor, in the order the pod lists them
            for (int m = 0; m < rbd.monitors().size(); m++) {
                inserts.add(conn.insertInto(POD_RBD_MONITORS, POD_UID, VOLUME_INDEX, MONITOR_INDEX, MONITOR)
                                .values(uid, index, m, rbd.monitors().get(m)));
            }
        }
        return inserts;
    }

    private static ConflictVolume conflictVolume(final Record row, final List<String> monitors) {
        final String key = row.get(VOLUME_KEY);
        final boolean readOnly = Boolean.TRUE.equals(row.get(READ_ONLY));
        return switch (Kind.valueOf(row.get(KIND))) {
            case GCE_PERSISTENT_DISK -> new ConflictVolume.GcePersistentDisk(key, readOnly);
            case AWS_ELASTIC_BLOCK_STORE -> new ConflictVolume.AwsElasticBlockStore(key);
            case ISCSI -> new ConflictVolume.Iscsi(key, readOnly);
            case RBD -> new ConflictVolume.Rbd(monitors, row.get(POOL), key, readOnly);
        };
    }

    private static long resourceVersion(final Pod pod) {
        final String resourceVersion = pod.getMetadata().getResourceVersion();
        if (resourceVersion == null || resourceVersion.isEmpty()) {
            return UNKNOWN_RESOURCE_VERSION;
        }
        try {
            return Long.parseLong(resourceVersion);
        } catch (final NumberFormatException e) {
            LOG.warn("Pod {} has a non-numeric resourceVersion {}", pod.getMetadata().getName(), resourceVersion);
            return UNKNOWN_RESOURCE_VERSION;
        }
    }

    void addNode(final Node node) {
        final long now = System.nanoTime();
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        conn.batch(conn.deleteFrom(NODE_INFO).where(NODE_NAME.eq(node.getMetadata().getName())),
                   conn.insertInto(NODE_INFO, NODE_UID, NODE_NAME)
                       .values(node.getMetadata().getUid(), node.getMetadata().getName()))
            .execute();
        LOG.info("{} node added in {}ns", node.getMetadata().getName(), (System.nanoTime() - now));
    }

    void deleteNode(final Node node) {
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        conn.deleteFrom(NODE_INFO)
            .where(NODE_NAME.eq(node.getMetadata().getName()))
            .execute();
        LOG.info("Node {} deleted", node.getMetadata().getName());
    }

    /**
     * Reads all nodes and assigned pods in one transaction.
     */
    ClusterSnapshot snapshot() {
        final long now = System.nanoTime();
        final DSLContext conn = dbConnectionPool.getConnectionToDb();
        final ClusterSnapshot snapshot = conn.transactionResult(configuration -> {
            final DSLContext tx = DSL.using(configuration);
            final List<String> nodeNames = tx.select(NODE_NAME).from(NODE_INFO).fetch(NODE_NAME);
            final Result<Record5<String, String, String, String, Integer>> pods =
                    tx.select(UID, POD_NAME, NAMESPACE, POD_NODE_NAME, PRIORITY)
                      .from(POD_INFO)
                      .where(POD_NODE_NAME.isNotNull())
                      .fetch();
            final Result<Record7<String, Integer, String, String, String, String, Boolean>> volumes =
                    tx.select(POD_UID, VOLUME_INDEX, VOLUME_NAME, KIND, VOLUME_KEY, POOL, READ_ONLY)
                      .from(POD_CONFLICT_VOLUMES)
                      .fetch();
            final Result<Record3<String, Integer, String>> monitors =
                    tx.select(POD_UID, VOLUME_INDEX, MONITOR)
                      .from(POD_RBD_MONITORS)
                      .orderBy(POD_UID, VOLUME_INDEX, MONITOR_INDEX)
                      .fetch();
            final Result<Record4<String, Integer, String, String>> claims =
                    tx.select(POD_UID, VOLUME_INDEX, VOLUME_NAME, CLAIM_NAME)
                      .from(POD_CLAIMS)
                      .fetch();
            return ClusterSnapshot.of(nodeNames, toPods(pods, volumes, monitors, claims));
        });
        LOG.debug("Took a snapshot of {} nodes in {}ns", snapshot.numNodes(), System.nanoTime() - now);
        return snapshot;
    }

    /**
     * Rebuilds skeleton pods holding the metadata, node assignment, priority and volumes that were stored.
     */
    private static List<Pod> toPods(final Result<Record5<String, String, String, String, Integer>> podRows,
                                    final Result<? extends Record> volumeRows,
                                    final Result<Record3<String, Integer, String>> monitorRows,
                                    final Result<? extends Record> claimRows) {
        final Map<String, Map<Integer, List<String>>> monitorsByVolume = new HashMap<>();
        for (final Record3<String, Integer, String> row : monitorRows) {
            monitorsByVolume.computeIfAbsent(row.value1(), k -> new HashMap<>())
                            .computeIfAbsent(row.value2(), k -> new ArrayList<>())
                            .add(row.value3());
        }
        final Map<String, TreeMap<Integer, Volume>> volumesByPod = new HashMap<>();
        for (final Record row : volumeRows) {
            final String uid = row.get(POD_UID);
            final Integer index = row.get(VOLUME_INDEX);
            final List<String> monitors = monitorsByVolume.getOrDefault(uid, Collections.emptyMap())
                                                          .getOrDefault(index, Collections.emptyList());
            volumesByPod.computeIfAbsent(uid, k -> new TreeMap<>())
                        .put(index, conflictVolume(row, monitors).toVolume(row.get(VOLUME_NAME)));
        }
        for (final Record row : claimRows) {
            final Volume volume = new Volume();
            volume.setName(row.get(VOLUME_NAME));
            final PersistentVolumeClaimVolumeSource source = new PersistentVolumeClaimVolumeSource();
            source.setClaimName(row.get(CLAIM_NAME));
            volume.setPersistentVolumeClaim(source);
            volumesByPod.computeIfAbsent(row.get(POD_UID), k -> new TreeMap<>())
                        .put(row.get(VOLUME_INDEX), volume);
        }
        final List<Pod> pods = new ArrayList<>(podRows.size());
        for (final Record5<String, String, String, String, Integer> row : podRows) {
            final Pod pod = new Pod();
            final ObjectMeta meta = new ObjectMeta();
            meta.setUid(row.value1());
            meta.setName(row.value2());
            meta.setNamespace(row.value3());
            final PodSpec spec = new PodSpec();
            spec.setNodeName(row.value4());
            spec.setPriority(row.value5());
            final TreeMap<Integer, Volume> volumes = volumesByPod.get(row.value1());
            spec.setVolumes(volumes == null ? new ArrayList<>() : new ArrayList<>(volumes.values()));
            pod.setMetadata(meta);
            pod.setSpec(spec);
            pods.add(pod);
        }
        return pods;
    }
}
