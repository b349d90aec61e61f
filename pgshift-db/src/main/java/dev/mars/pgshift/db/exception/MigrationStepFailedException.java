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

import dev.mars.pgshift.db.revision.Direction;

/**
 * Thrown when a single migration step fails. The step's transaction has been rolled back;
 * steps committed before it stay applied. The database error is kept as the cause.
 */
public class MigrationStepFailedException extends MigrationException {

    private final Direction direction;

    public MigrationStepFailedException(String revisionId, Direction direction, String lastAppliedRevision,
                                        Throwable cause) {
        super(revisionId, lastAppliedRevision, "Migration step " + direction.label() + " " + revisionId + " failed: "
            + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.direction = direction;
    }

    public Direction getDirection() { return direction; }
}
