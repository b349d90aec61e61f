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

import dev.mars.pgshift.db.config.PgConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DumpTool} running the PostgreSQL client binaries {@code pg_dump} and {@code psql}.
 *
 * <p>The password is handed to the child process through {@code PGPASSWORD}, never on the
 * command line. Dumps are taken with {@code --clean --if-exists} so that replaying them through
 * {@code psql} replaces the live schema objects; restores run with {@code ON_ERROR_STOP} in a
 * single transaction.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class ProcessDumpTool implements DumpTool {
    private static final Logger logger = LoggerFactory.getLogger(ProcessDumpTool.class);

    private final String pgDumpCommand;
    private final String psqlCommand;

    public ProcessDumpTool(String pgDumpCommand, String psqlCommand) {
        this.pgDumpCommand = pgDumpCommand;
        this.psqlCommand = psqlCommand;
    }

    @Override
    public DumpResult dump(PgConnectionConfig connection, Path output) throws IOException {
        return run(buildDumpCommand(connection, output), connection);
    }

    @Override
    public DumpResult restore(PgConnectionConfig connection, Path input) throws IOException {
        return run(buildRestoreCommand(connection, input), connection);
    }

    @Override
    public String name() {
        return pgDumpCommand;
    }

    List<String> buildDumpCommand(PgConnectionConfig connection, Path output) {
        List<String> command = new ArrayList<>(connectionArguments(pgDumpCommand, connection));
        command.add("-f");
        command.add(output.toString());
        command.add("--no-owner");
        command.add("--no-acl");
        command.add("--clean");
        command.add("--if-exists");
        return command;
    }

    List<String> buildRestoreCommand(PgConnectionConfig connection, Path input) {
        List<String> command = new ArrayList<>(connectionArguments(psqlCommand, connection));
        command.add("-v");
        command.add("ON_ERROR_STOP=1");
        command.add("--single-transaction");
        command.add("-f");
        command.add(input.toString());
        return command;
    }

    private static List<String> connectionArguments(String executable, PgConnectionConfig connection) {
        List<String> arguments = new ArrayList<>();
        arguments.add(executable);
        arguments.addAll(connection.getClientArguments());
        return arguments;
    }

    private DumpResult run(List<String> command, PgConnectionConfig connection) throws IOException {
        logger.debug("Running {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.environment().putAll(connection.getClientEnvironment());

        Process process = pb.start();
        String errorOutput;
        try (InputStream stderr = process.getErrorStream()) {
            errorOutput = new String(stderr.readAllBytes(), StandardCharsets.UTF_8);
        }

        try {
            int exitStatus = process.waitFor();
            logger.debug("{} exited with status {}", command.get(0), exitStatus);
            return new DumpResult(exitStatus, errorOutput);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        }
    }
}
