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


import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.exception.MigrationException;
import dev.mars.pgshift.db.migration.MigrationListener;
import dev.mars.pgshift.db.migration.MigrationRequest;
import dev.mars.pgshift.db.migration.MigrationResult;
import dev.mars.pgshift.db.migration.MigrationRunner;
import dev.mars.pgshift.db.migration.MigrationState;
import dev.mars.pgshift.db.migration.SchemaDatabase;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Common wiring of {@code up} and {@code down}: resolves the environment, runs the migration and
 * prints progress. On failure the applied revision is re-read from the database so that the
 * operator sees where the schema actually stands; if that read fails too, the migration failure
 * is still the one reported.
 */
abstract class AbstractMigrationCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EnvironmentOption environment = new EnvironmentOption();

    @CommandLine.Option(names = {"-r", "--revision"},
            description = "Target revision id, or 'base' for the empty schema")
    String revision;

    @CommandLine.Option(names = "--no-backup", description = "Skip the pre-migration backup")
    boolean noBackup;

    protected abstract MigrationResult migrate(MigrationRunner runner, MigrationRequest request);

    @Override
    public Integer call() throws Exception {
        PgShiftContext context = parent.context();
        Environment env = environment.get();
        RevisionCatalog catalog = context.loadCatalog();
        PrintWriter out = spec.commandLine().getOut();

        MigrationRequest request = MigrationRequest.to(revision);
        if (noBackup) {
            request = request.withoutBackup();
        }

        try (SchemaDatabase database = context.openDatabase(env)) {
            MigrationRunner runner = new MigrationRunner(env, catalog, database, context.backupService(),
                context.metrics(), progress(out));
            try {
                MigrationResult result = migrate(runner, request);
                report(out, result);
                return ExitCodes.OK;
            } catch (MigrationException e) {
                PrintWriter err = spec.commandLine().getErr();
                try {
                    err.println("Last applied revision: " + runner.current().orElse(RevisionCatalog.BASE));
                } catch (RuntimeException readError) {
                    err.println("Last applied revision: unknown (" + readError.getMessage() + ")");
                    e.addSuppressed(readError);
                }
                err.flush();
                throw e;
            }
        }
    }

    private static MigrationListener progress(PrintWriter out) {
        return (state, step) -> {
            if (state == MigrationState.BACKING_UP) {
                out.println("Creating pre-migration backup...");
            } else if (state == MigrationState.APPLYING_STEP) {
                out.println("Running " + step.direction().label() + " " + step.revisionId());
            }
            out.flush();
        };
    }

    private static void report(PrintWriter out, MigrationResult result) {
        result.getBackup().ifPresent(backup -> out.println("Backup: " + backup.path()));
        if (result.isAlreadyAtTarget()) {
            out.println("Already at target " + result.describeTo());
        } else {
            out.println("Migrated " + result.environment() + " from " + result.describeFrom() + " to "
                + result.describeTo() + " (" + result.appliedRevisions().size() + " revision(s))");
        }
        out.flush();
    }
}
