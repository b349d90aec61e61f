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
 * Thrown when a downgrade would pass a revision whose downgrade is deliberately disallowed.
 * Distinguishes an intentional refusal from a broken down script.
 */
public class IrreversibleMigrationException extends MigrationException {

    private final String reason;

    public IrreversibleMigrationException(String revisionId, String lastAppliedRevision, String reason) {
        super(revisionId, lastAppliedRevision, "Revision " + revisionId + " cannot be downgraded: " + reason);
        this.reason = reason;
    }

    /** Returns the rationale recorded with the revision */
    public String getReason() { return reason; }
}
