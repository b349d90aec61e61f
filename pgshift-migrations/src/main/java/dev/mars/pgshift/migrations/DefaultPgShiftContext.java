package dev.mars.pgshift.migrations;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.pgshift.db.backup.BackupService;
import dev.mars.pgshift.db.backup.PgDumpBackupService;
import dev.mars.pgshift.db.backup.ProcessDumpTool;
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.config.EnvironmentResolver;
import dev.mars.pgshift.db.config.PgShiftConfiguration;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import dev.mars.pgshift.db.migration.JdbcSchemaDatabase;
import dev.mars.pgshift.db.migration.SchemaDatabase;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import dev.mars.pgshift.db.revision.RevisionCatalogLoader;

import java.time.Clock;
import java.util.Map;

/**
 * Production wiring: configuration and connection parameters come from the process
 * environment, scripts run over JDBC, dumps through the PostgreSQL client binaries.
 *
 * <p>Configuration is loaded on first use so that {@code --help} works without any
 * environment set up.
 */
public class DefaultPgShiftContext implements PgShiftContext {

    private final Map<String, String> variables;
    private final MigrationMetrics metrics = MigrationMetrics.inMemory();
    private PgShiftConfiguration configuration;

    public DefaultPgShiftContext() {
        this(System.getenv());
    }

    public DefaultPgShiftContext(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    @Override
    public synchronized PgShiftConfiguration configuration() {
        if (configuration == null) {
            configuration = new PgShiftConfiguration(
                System.getProperty("pgshift.profile", variables.getOrDefault("PGSHIFT_PROFILE", "default")),
                variables);
        }
        return configuration;
    }

    @Override
    public RevisionCatalog loadCatalog() {
        return new RevisionCatalogLoader().load(configuration().getVersionsDir());
    }

    @Override
    public SchemaDatabase openDatabase(Environment environment) {
        PgShiftConfiguration config = configuration();
        return new JdbcSchemaDatabase(resolver().resolve(environment), config.getPointerTable(),
            config.getStatementTimeout());
    }

    @Override
    public BackupService backupService() {
        PgShiftConfiguration config = configuration();
        return new PgDumpBackupService(config.getBackupDir(),
            new ProcessDumpTool(config.getPgDumpCommand(), config.getPsqlCommand()),
            resolver()::resolve, clock(), metrics);
    }

    @Override
    public MigrationMetrics metrics() {
        return metrics;
    }

    @Override
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private EnvironmentResolver resolver() {
        return new EnvironmentResolver(variables);
    }
}
