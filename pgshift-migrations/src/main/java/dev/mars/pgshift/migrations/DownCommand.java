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


import dev.mars.pgshift.db.migration.MigrationRequest;
import dev.mars.pgshift.db.migration.MigrationResult;
import dev.mars.pgshift.db.migration.MigrationRunner;
import picocli.CommandLine;

@CommandLine.Command(
        name = "down",
        mixinStandardHelpOptions = true,
        description = "Revert revisions down to --revision, or one revision back"
)
public class DownCommand extends AbstractMigrationCommand {

    @Override
    protected MigrationResult migrate(MigrationRunner runner, MigrationRequest request) {
        return runner.downgrade(request);
    }
}
