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


import dev.mars.pgshift.db.revision.MigrationStep;

/**
 * Observer of {@link MigrationRunner} state transitions.
 */
@FunctionalInterface
public interface MigrationListener {

    MigrationListener NONE = (state, step) -> { };

    /**
     * @param state the state just entered
     * @param step the step being applied or just committed, null for states outside a step
     */
    void onStateChange(MigrationState state, MigrationStep step);
}
