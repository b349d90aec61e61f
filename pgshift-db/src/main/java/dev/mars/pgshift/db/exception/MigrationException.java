package dev.mars.pgshift.db.exception;

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

/**
 * Base class for failures raised while the migration runner applies a resolved path.
 * Carries the id of the revision whose step did not complete and the applied-revision pointer
 * as it stands after the failure.
 */
public class MigrationException extends PgShiftException {

    private final String revisionId;
    private final String lastAppliedRevision;

    public MigrationException(String revisionId, String lastAppliedRevision, String message) {
        super(message);
        this.revisionId = revisionId;
        this.lastAppliedRevision = lastAppliedRevision;
    }

    public MigrationException(String revisionId, String lastAppliedRevision, String message, Throwable cause) {
        super(message, cause);
        this.revisionId = revisionId;
        this.lastAppliedRevision = lastAppliedRevision;
    }

    /** Returns the revision whose step failed */
    public String getRevisionId() { return revisionId; }

    /** Returns the pointer value left in the database, or null when no revision is applied */
    public String getLastAppliedRevision() { return lastAppliedRevision; }
}
