/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.jooq.impl.DSL.using;

/**
 * A private, in-memory H2 database holding the cluster state the scheduler has observed.
 */
class DBConnectionPool {
    private static final Settings JOOQ_SETTING = new Settings().withExecuteLogging(false);
    private static final String SCHEMA_RESOURCE = "/cluster_state_tables.sql";
    private final String databaseName;
    private final DataSource ds;

    DBConnectionPool() {
        this.databaseName = UUID.randomUUID().toString();
        final HikariConfig config = new HikariConfig();
        config.setJdbcUrl(String.format("jdbc:h2:mem:%s;DB_CLOSE_DELAY=-1", databaseName));
        config.setMaximumPoolSize(20);
        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "250");
        config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        this.ds = new HikariDataSource(config);
        getSchema().forEach(getConnectionToDb()::execute);
    }

    DSLContext getConnectionToDb() {
        return using(ds, SQLDialect.H2, JOOQ_SETTING);
    }

    /**
     * Used only for refreshing the DB state between tests
     */
    @VisibleForTesting
    void refresh() {
        getConnectionToDb().execute("drop all objects");
        getSchema().forEach(getConnectionToDb()::execute);
    }

    static List<String> getSchema() {
        final InputStream resourceAsStream = Objects.requireNonNull(
                DBConnectionPool.class.getResourceAsStream(SCHEMA_RESOURCE), SCHEMA_RESOURCE + " is missing");
        try (final BufferedReader tables = new BufferedReader(new InputStreamReader(resourceAsStream,
                StandardCharsets.UTF_8))) {
            final String schemaAsString = tables.lines()
                    .filter(line -> !line.startsWith("--")) // remove SQL comments
                    .collect(Collectors.joining("\n"));
            return Splitter.on(";")
                    .trimResults()
                    .omitEmptyStrings()
                    .splitToList(schemaAsString);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
