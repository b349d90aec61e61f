package dev.mars.pgshift.migrations;

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


import dev.mars.pgshift.db.exception.BackupException;
import dev.mars.pgshift.db.exception.BackupNotFoundException;
import dev.mars.pgshift.db.exception.DatabaseAccessException;
import dev.mars.pgshift.db.exception.IrreversibleMigrationException;
import dev.mars.pgshift.db.exception.MigrationException;
import dev.mars.pgshift.db.exception.RestoreFailedException;
import dev.mars.pgshift.db.exception.RevisionStoreException;
import picocli.CommandLine;

/**
 * Process exit codes of the {@code pgshift} command and the mapping from failures to them.
 */
public final class ExitCodes implements CommandLine.IExitCodeExceptionMapper {

    public static final int OK = 0;
    public static final int UNEXPECTED = 1;
    public static final int USAGE = 2;
    public static final int BACKUP_FAILED = 3;
    public static final int STEP_FAILED = 4;
    public static final int IRREVERSIBLE = 5;
    public static final int REVISION_STORE = 6;
    public static final int BACKUP_NOT_FOUND = 7;
    public static final int RESTORE_FAILED = 8;
    public static final int DATABASE_UNAVAILABLE = 9;

    public static final ExitCodes INSTANCE = new ExitCodes();

    private ExitCodes() {
    }

    @Override
    public int getExitCode(Throwable exception) {
        return forException(exception);
    }

    public static int forException(Throwable exception) {
        // Subclasses before their parents
        if (exception instanceof BackupNotFoundException) {
            return BACKUP_NOT_FOUND;
        }
        if (exception instanceof RestoreFailedException) {
            return RESTORE_FAILED;
        }
        if (exception instanceof BackupException) {
            return BACKUP_FAILED;
        }
        if (exception instanceof IrreversibleMigrationException) {
            return IRREVERSIBLE;
        }
        if (exception instanceof MigrationException) {
            return STEP_FAILED;
        }
        if (exception instanceof DatabaseAccessException) {
            return DATABASE_UNAVAILABLE;
        }
        if (exception instanceof RevisionStoreException) {
            return REVISION_STORE;
        }
        if (exception instanceof IllegalArgumentException || exception instanceof IllegalStateException
                || exception instanceof CommandLine.ParameterException) {
            return USAGE;
        }
        return UNEXPECTED;
    }
}
