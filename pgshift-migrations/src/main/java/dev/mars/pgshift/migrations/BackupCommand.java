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


import dev.mars.pgshift.db.backup.BackupRecord;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Takes a {@code pg_dump} snapshot of an environment outside any migration.
 */
@CommandLine.Command(
        name = "backup",
        mixinStandardHelpOptions = true,
        description = "Create a database backup"
)
public class BackupCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EnvironmentOption environment = new EnvironmentOption();

    @Override
    public Integer call() {
        BackupRecord record = parent.context().backupService().backup(environment.get());
        PrintWriter out = spec.commandLine().getOut();
        out.println("Backup created: " + record.path() + " (" + record.sizeBytes() + " bytes)");
        out.flush();
        return ExitCodes.OK;
    }
}
