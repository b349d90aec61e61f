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
 * Thrown when the restore tool rejects a dump. The restore runs in a single transaction, so
 * the live schema is left as it was before the attempt.
 */
public class RestoreFailedException extends BackupException {

    private final Path path;
    private final int exitStatus;

    public RestoreFailedException(Path path, int exitStatus, String message) {
        super("Restore of " + path + " failed (exit status " + exitStatus + ")"
            + (message == null || message.isBlank() ? "" : ": " + message.trim()));
        this.path = path;
        this.exitStatus = exitStatus;
    }

    public RestoreFailedException(Path path, String message, Throwable cause) {
        super("Restore of " + path + " failed: " + message, cause);
        this.path = path;
        this.exitStatus = BackupFailedException.NOT_STARTED;
    }

    public Path getPath() { return path; }

    public int getExitStatus() { return exitStatus; }
}
