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


import dev.mars.pgshift.db.revision.Downgrade;
import dev.mars.pgshift.db.revision.Revision;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Lists the revision chain from root to head. Reads the versions directory only.
 */
@CommandLine.Command(
        name = "history",
        mixinStandardHelpOptions = true,
        description = "List revisions from root to head"
)
public class HistoryCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RevisionCatalog catalog = parent.context().loadCatalog();
        PrintWriter out = spec.commandLine().getOut();
        if (catalog.isEmpty()) {
            out.println("No revisions");
        }
        for (Revision revision : catalog.history()) {
            String parentId = revision.isRoot() ? RevisionCatalog.BASE : revision.getParentId();
            out.printf("%-40s <- %-40s %s%s%n",
                    revision.getId(),
                    parentId,
                    revision.getDescription() == null ? "" : revision.getDescription(),
                    revision.getDowngrade() instanceof Downgrade.Irreversible ? " [irreversible]" : "");
        }
        out.flush();
        return ExitCodes.OK;
    }
}
