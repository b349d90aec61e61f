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


import java.util.Objects;

/**
 * Parameters of one {@code up} or {@code down} run.
 *
 * @param target the revision to reach, {@code "base"} for the empty schema, or null for the
 *               direction's default (head for up, the parent of the current revision for down)
 * @param backupPolicy whether to snapshot before the first step
 */
public record MigrationRequest(String target, BackupPolicy backupPolicy) {

    public MigrationRequest {
        Objects.requireNonNull(backupPolicy, "backupPolicy cannot be null");
    }

    public static MigrationRequest toDefault() {
        return new MigrationRequest(null, BackupPolicy.REQUIRED);
    }

    public static MigrationRequest to(String target) {
        return new MigrationRequest(target, BackupPolicy.REQUIRED);
    }

    public MigrationRequest withoutBackup() {
        return new MigrationRequest(target, BackupPolicy.SKIP);
    }
}
