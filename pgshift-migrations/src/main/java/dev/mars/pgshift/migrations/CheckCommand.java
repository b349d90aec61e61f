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


import dev.mars.pgshift.db.revision.RevisionCatalog;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Validates the revision chain: unique ids, one root, one head, resolvable parents, no cycles.
 */
@CommandLine.Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Validate the revision catalog"
)
public class CheckCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    PgShiftCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RevisionCatalog catalog = parent.context().loadCatalog();
        List<String> problems = catalog.validate();
        if (problems.isEmpty()) {
            PrintWriter out = spec.commandLine().getOut();
            out.println("Catalog OK: " + catalog.size() + " revision(s)"
                + (catalog.isEmpty() ? "" : ", head " + catalog.head()));
            out.flush();
            return ExitCodes.OK;
        }
        PrintWriter err = spec.commandLine().getErr();
        problems.forEach(problem -> err.println("Invalid catalog: " + problem));
        err.flush();
        return ExitCodes.REVISION_STORE;
    }
}
