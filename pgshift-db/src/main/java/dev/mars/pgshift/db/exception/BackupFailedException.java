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
 * Thrown when the dump tool exits with a non-zero status, cannot be started, or produces an
 * empty dump file. No backup record exists when this is raised.
 */
public class BackupFailedException extends BackupException {

    /** Exit status reported when the dump process could not be started at all. */
    public static final int NOT_STARTED = -1;

    private final String environment;
    private final int exitStatus;

    public BackupFailedException(String environment, int exitStatus, String message) {
        super(formatMessage(environment, exitStatus, message));
        this.environment = environment;
        this.exitStatus = exitStatus;
    }

    public BackupFailedException(String environment, int exitStatus, String message, Throwable cause) {
        super(formatMessage(environment, exitStatus, message), cause);
        this.environment = environment;
        this.exitStatus = exitStatus;
    }

    /** Returns the environment the backup was taken for */
    public String getEnvironment() { return environment; }

    /** Returns the dump tool exit status, or {@link #NOT_STARTED} */
    public int getExitStatus() { return exitStatus; }

    private static String formatMessage(String environment, int exitStatus, String message) {
        StringBuilder sb = new StringBuilder("Backup failed for environment '").append(environment).append("'");
        if (exitStatus != NOT_STARTED) {
            sb.append(" (exit status ").append(exitStatus).append(")");
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message.trim());
        }
        return sb.toString();
    }
}
