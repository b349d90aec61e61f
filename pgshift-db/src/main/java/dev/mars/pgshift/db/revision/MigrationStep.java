package dev.mars.pgshift.db.revision;

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
 * One element of a resolved path: a revision and the direction it is applied in.
 *
 * @param revision the revision to apply or revert
 * @param direction {@link Direction#UP} to run the up script, {@link Direction#DOWN} to revert
 */
public record MigrationStep(Revision revision, Direction direction) {

    public MigrationStep {
        Objects.requireNonNull(revision, "revision");
        Objects.requireNonNull(direction, "direction");
    }

    public String revisionId() {
        return revision.getId();
    }

    /**
     * Returns the applied-revision pointer value once this step commits: the revision itself
     * going up, its parent going down (null meaning no revision applied).
     */
    public String resultingRevisionId() {
        return direction == Direction.UP ? revision.getId() : revision.getParentId();
    }
}
