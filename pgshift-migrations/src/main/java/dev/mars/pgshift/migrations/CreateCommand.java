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


import dev.mars.pgshift.db.revision.Revision;
import dev.mars.pgshift.db.revision.RevisionWriter;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

/**
 * Appends a new revision after head, with empty up and down scripts to fill in.
 */
@CommandLine.Command(
        name = "create",
        mixinStandardHelpOptions = true,
        description = "Create a new revision after head"
)
public class CreateCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-m", "--message"}, required = true, description = "Revision description")
    String message;

    @Override
    public Integer call() {
        PgShiftContext context = parent.context();
        Path versionsDir = context.configuration().getVersionsDir();
        Revision revision = new RevisionWriter().create(versionsDir, context.loadCatalog(), message,
            LocalDate.now(context.clock()));

        PrintWriter out = spec.commandLine().getOut();
        out.println("Created revision " + revision.getId() + " in " + versionsDir);
        out.flush();
        return ExitCodes.OK;
    }
}
