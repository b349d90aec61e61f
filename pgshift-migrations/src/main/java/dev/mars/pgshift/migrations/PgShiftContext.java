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
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.config.PgShiftConfiguration;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import dev.mars.pgshift.db.migration.SchemaDatabase;
import dev.mars.pgshift.db.revision.RevisionCatalog;

import java.time.Clock;

/**
 * Collaborators the CLI commands are wired with. The process entry point uses
 * {@link DefaultPgShiftContext}; tests supply fakes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public interface PgShiftContext {

    PgShiftConfiguration configuration();

    /**
     * Loads the revision catalog from the configured versions directory.
     */
    RevisionCatalog loadCatalog();

    /**
     * Opens a session on the environment's database. The caller closes it.
     */
    SchemaDatabase openDatabase(Environment environment);

    BackupService backupService();

    MigrationMetrics metrics();

    Clock clock();
}
