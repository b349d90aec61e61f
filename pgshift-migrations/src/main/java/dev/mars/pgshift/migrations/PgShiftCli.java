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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Command line entry point for PgShift migrations and backups.
 *
 * <p><b>Connection parameters</b> are read per environment from
 * {@code <ENV>_POSTGRES_HOST}, {@code _PORT}, {@code _DB} (required), {@code _USER} and
 * {@code _PASSWORD}, e.g. {@code DEV_POSTGRES_DB}.
 *
 * <p><b>Examples:</b>
 * <pre>
 * # Apply every pending revision, taking a backup first
 * java -jar pgshift-migrations.jar up --env dev
 *
 * # Revert to a given revision without a backup
 * java -jar pgshift-migrations.jar down --env dev --revision 002_add_identity_providers --no-backup
 *
 * # Keep the two newest backups
 * java -jar pgshift-migrations.jar cleanup --env dev --keep 2
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
@CommandLine.Command(
        name = "pgshift",
        mixinStandardHelpOptions = true,
        version = "pgshift 1.0",
        description = "PostgreSQL schema migrations with pre-migration backups",
        subcommands = {
                UpCommand.class,
                DownCommand.class,
                CurrentCommand.class,
                HistoryCommand.class,
                CreateCommand.class,
                CheckCommand.class,
                BackupCommand.class,
                ListBackupsCommand.class,
                RestoreCommand.class,
                CleanupCommand.class
        }
)
public class PgShiftCli implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(PgShiftCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final PgShiftContext context;

    public PgShiftCli(PgShiftContext context) {
        this.context = context;
    }

    PgShiftContext context() {
        return context;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.USAGE;
    }

    /**
     * Builds the command line with exit code mapping and error reporting installed. Once a
     * command has run, the steps and backups it recorded are logged as one summary line.
     */
    public static CommandLine newCommandLine(PgShiftContext context) {
        return new CommandLine(new PgShiftCli(context))
                .setExecutionStrategy(parseResult -> {
                    try {
                        return new CommandLine.RunLast().execute(parseResult);
                    } finally {
                        logSummary(context);
                    }
                })
                .setExecutionExceptionHandler(new ErrorReporter())
                .setExitCodeExceptionMapper(ExitCodes.INSTANCE);
    }

    private static void logSummary(PgShiftContext context) {
        String summary = context.metrics().summary();
        if (!summary.isEmpty()) {
            logger.info("Run summary: {}", summary);
        }
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new DefaultPgShiftContext()).execute(args);
        System.exit(exitCode);
    }
}
