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


/**
 * States of a migration run. A run moves
 * {@code IDLE -> RESOLVING_PATH -> BACKING_UP -> APPLYING_STEP -> COMMITTED} and repeats the last two
 * per step before reaching {@code DONE}. Any error moves it to {@code FAILED}.
 */
public enum MigrationState {
    IDLE,
    RESOLVING_PATH,
    BACKING_UP,
    APPLYING_STEP,
    COMMITTED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
