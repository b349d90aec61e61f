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
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Deletes all but the newest backups of an environment.
 */
@CommandLine.Command(
        name = "cleanup",
        mixinStandardHelpOptions = true,
        description = "Delete old backups, keeping the newest ones"
)
public class CleanupCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EnvironmentOption environment = new EnvironmentOption();

    @CommandLine.Option(names = {"-k", "--keep"},
            description = "Number of backups to keep (default: pgshift.backup.keep)")
    Integer keep;

    @Override
    public Integer call() {
        PgShiftContext context = parent.context();
        int retained = keep != null ? keep : context.configuration().getDefaultKeep();
        List<BackupRecord> removed = context.backupService().cleanup(environment.get(), retained);

        PrintWriter out = spec.commandLine().getOut();
        removed.forEach(record -> out.println("Removed " + record.path()));
        out.println("Removed " + removed.size() + " backup(s), keeping at most " + retained);
        out.flush();
        return ExitCodes.OK;
    }
}
