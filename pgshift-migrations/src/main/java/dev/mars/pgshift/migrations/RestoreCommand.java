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


import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Restores a dump into an environment. Destructive, so it refuses to run without {@code --yes}.
 * No backup is taken beforehand.
 */
@CommandLine.Command(
        name = "restore",
        mixinStandardHelpOptions = true,
        description = "Restore a backup file into the environment's database"
)
public class RestoreCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EnvironmentOption environment = new EnvironmentOption();

    @CommandLine.Option(names = {"-f", "--file"}, required = true, description = "Dump file to restore")
    Path file;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Confirm replacing the database content")
    boolean confirmed;

    @Override
    public Integer call() {
        if (!confirmed) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Restoring " + file + " replaces the content of the " + environment.get()
                + " database. Re-run with --yes to confirm.");
            err.flush();
            return ExitCodes.USAGE;
        }
        parent.context().backupService().restore(environment.get(), file);
        PrintWriter out = spec.commandLine().getOut();
        out.println("Backup restored from: " + file);
        out.flush();
        return ExitCodes.OK;
    }
}
