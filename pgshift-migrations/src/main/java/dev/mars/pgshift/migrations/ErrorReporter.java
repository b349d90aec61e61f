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


import dev.mars.pgshift.db.exception.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Prints a failed command's error to stderr and picks its exit code. Known failures get a
 * one-line message; anything else is logged with its stack trace.
 */
class ErrorReporter implements CommandLine.IExecutionExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ErrorReporter.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        int exitCode = ExitCodes.forException(ex);
        PrintWriter err = commandLine.getErr();
        err.println("Error: " + ex.getMessage());
        if (ex instanceof MigrationException migrationError && migrationError.getRevisionId() != null) {
            err.println("  Failed revision:       " + migrationError.getRevisionId());
        }
        if (exitCode == ExitCodes.UNEXPECTED) {
            logger.error("Command failed unexpectedly", ex);
        } else {
            logger.debug("Command failed with exit code {}", exitCode, ex);
        }
        err.flush();
        return exitCode;
    }
}
