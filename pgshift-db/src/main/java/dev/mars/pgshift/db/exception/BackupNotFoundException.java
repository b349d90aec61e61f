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

import java.nio.file.Path;

/**
 * Thrown by restore when the requested dump does not exist or was not produced for the
 * target environment and database.
 */
public class BackupNotFoundException extends BackupException {

    private final Path path;

    public BackupNotFoundException(Path path, String reason) {
        super("Backup not usable: " + path + " (" + reason + ")");
        this.path = path;
    }

    public Path getPath() { return path; }
}
