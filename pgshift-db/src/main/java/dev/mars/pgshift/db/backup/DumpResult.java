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

/**
 * Outcome of a dump or restore process.
 *
 * @param exitStatus process exit status
 * @param errorOutput captured standard error, possibly empty
 */
public record DumpResult(int exitStatus, String errorOutput) {

    public boolean isSuccess() {
        return exitStatus == 0;
    }
}
