package dev.mars.pgshift.db.migration;

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


import dev.mars.pgshift.db.backup.BackupRecord;
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.revision.Direction;
import dev.mars.pgshift.db.revision.RevisionCatalog;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a completed migration run.
 *
 * @param environment the migrated environment
 * @param direction up or down
 * @param fromRevision pointer before the run, null for base
 * @param toRevision pointer after the run, null for base
 * @param appliedRevisions ids of the revisions applied or reverted, in execution order
 * @param backup the backup taken before the first step, null if none was taken
 */
public record MigrationResult(Environment environment,
                              Direction direction,
                              String fromRevision,
                              String toRevision,
                              List<String> appliedRevisions,
                              BackupRecord backup) {

    public MigrationResult {
        appliedRevisions = List.copyOf(appliedRevisions);
    }

    public boolean isAlreadyAtTarget() {
        return appliedRevisions.isEmpty();
    }

    public Optional<BackupRecord> getBackup() {
        return Optional.ofNullable(backup);
    }

    public String describeFrom() {
        return fromRevision == null ? RevisionCatalog.BASE : fromRevision;
    }

    public String describeTo() {
        return toRevision == null ? RevisionCatalog.BASE : toRevision;
    }
}
