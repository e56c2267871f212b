/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.table;

/**
 * Table and column references for cluster_state_tables.sql.
 */
final class ClusterStateTables {
    static final Table<Record> NODE_INFO = table("node_info");
    static final Field<String> NODE_UID = field("uid", String.class);
    static final Field<String> NODE_NAME = field("name", String.class);

    static final Table<Record> POD_INFO = table("pod_info");
    static final Field<String> UID = field("uid", String.class);
    static final Field<String> POD_NAME = field("pod_name", String.class);
    static final Field<String> NAMESPACE = field("namespace", String.class);
    static final Field<String> POD_NODE_NAME = field("node_name", String.class);
    static final Field<Integer> PRIORITY = field("priority", Integer.class);
    static final Field<Long> RESOURCE_VERSION = field("resource_version", Long.class);

    static final Table<Record> POD_CONFLICT_VOLUMES = table("pod_conflict_volumes");
    static final Table<Record> POD_CLAIMS = table("pod_claims");
    static final Field<String> POD_UID = field("pod_uid", String.class);
    static final Field<Integer> VOLUME_INDEX = field("volume_index", Integer.class);
    static final Field<String> VOLUME_NAME = field("volume_name", String.class);
    static final Field<String> KIND = field("kind", String.class);
    static final Field<String> VOLUME_KEY = field("volume_key", String.class);
    static final Field<String> POOL = field("pool", String.class);
    static final Field<Boolean> READ_ONLY = field("read_only", Boolean.class);
    static final Field<String> CLAIM_NAME = field("claim_name", String.class);

    static final Table<Record> POD_RBD_MONITORS = table("pod_rbd_monitors");
    static final Field<Integer> MONITOR_INDEX = field("monitor_index", Integer.class);
    static final Field<String> MONITOR = field("monitor", String.class);

    private ClusterStateTables() {
    }
}
