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


import dev.mars.pgshift.db.migration.MigrationRunner;
import dev.mars.pgshift.db.migration.SchemaDatabase;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Prints the applied revision of an environment, or {@code base}.
 */
@CommandLine.Command(
        name = "current",
        mixinStandardHelpOptions = true,
        description = "Show the applied revision"
)
public class CurrentCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EnvironmentOption environment = new EnvironmentOption();

    @Override
    public Integer call() throws Exception {
        PgShiftContext context = parent.context();
        RevisionCatalog catalog = context.loadCatalog();
        try (SchemaDatabase database = context.openDatabase(environment.get())) {
            MigrationRunner runner = new MigrationRunner(environment.get(), catalog, database,
                context.backupService(), context.metrics());
            String current = runner.current().orElse(RevisionCatalog.BASE);
            boolean head = !catalog.isEmpty() && catalog.contains(current) && current.equals(catalog.head());
            spec.commandLine().getOut().println(current + (head ? " (head)" : ""));
            spec.commandLine().getOut().flush();
        }
        return ExitCodes.OK;
    }
}
