package dev.mars.pgshift.db.backup;

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

import dev.mars.pgshift.db.config.Environment;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable, restorable schema snapshots, independent of migration state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public interface BackupService {

    /**
     * Takes a full dump of the environment's database.
     *
     * @return the record, only once the dump tool succeeded and the file is non-empty
     * @throws dev.mars.pgshift.db.exception.BackupFailedException on non-zero exit or empty output
     */
    default BackupRecord backup(Environment environment) {
        return backup(environment, null);
    }

    /**
     * Takes a full dump and records the applied revision in its manifest.
     *
     * @param appliedRevision pointer value at backup time, null if unknown or base
     */
    BackupRecord backup(Environment environment, String appliedRevision);

    /**
     * Lists the environment's backups, newest first.
     */
    List<BackupRecord> list(Environment environment);

    /**
     * Replaces the environment's schema content with the dump. Destructive; callers confirm
     * intent first. No backup is taken beforehand.
     *
     * @throws dev.mars.pgshift.db.exception.BackupNotFoundException if the file is missing or was
     *         not produced for this environment and database
     * @throws dev.mars.pgshift.db.exception.RestoreFailedException if the restore tool fails
     */
    void restore(Environment environment, Path path);

    /**
     * Keeps the {@code keep} newest backups and deletes the rest.
     *
     * @return the deleted records, newest first
     * @throws IllegalArgumentException if {@code keep} is negative
     */
    List<BackupRecord> cleanup(Environment environment, int keep);
}
