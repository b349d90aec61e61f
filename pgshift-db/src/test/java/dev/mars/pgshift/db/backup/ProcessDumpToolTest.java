package dev.mars.pgshift.db.backup;

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


import dev.mars.pgshift.db.config.PgConnectionConfig;
import dev.mars.pgshift.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag(TestCategories.CORE)
class ProcessDumpToolTest {

    private final PgConnectionConfig connection = new PgConnectionConfig.Builder()
        .host("db.internal")
        .port(6432)
        .database("receipts")
        .username("migrator")
        .password("s3cret")
        .build();

    private final ProcessDumpTool tool = new ProcessDumpTool("pg_dump", "psql");

    @Test
    void dumpCommandIsPortableAndIdempotentOnRestore() {
        Path output = Paths.get("db_backups", "dev_20260217_093000_000.sql");

        List<String> command = tool.buildDumpCommand(connection, output);

        assertThat(command).containsExactly(
            "pg_dump", "-h", "db.internal", "-p", "6432", "-U", "migrator", "-d", "receipts",
            "-f", output.toString(), "--no-owner", "--no-acl", "--clean", "--if-exists");
    }

    @Test
    void restoreCommandStopsOnFirstError() {
        Path input = Paths.get("db_backups", "dev_20260217_093000_000.sql");

        List<String> command = tool.buildRestoreCommand(connection, input);

        assertThat(command).containsExactly(
            "psql", "-h", "db.internal", "-p", "6432", "-U", "migrator", "-d", "receipts",
            "-v", "ON_ERROR_STOP=1", "--single-transaction", "-f", input.toString());
    }

    @Test
    void passwordIsNeverOnTheCommandLine() {
        assertThat(tool.buildDumpCommand(connection, Paths.get("x.sql"))).doesNotContain("s3cret");
        assertThat(tool.buildRestoreCommand(connection, Paths.get("x.sql"))).doesNotContain("s3cret");
    }

    @Test
    void missingExecutableFailsToStart() {
        ProcessDumpTool missing = new ProcessDumpTool("pgshift-no-such-pg_dump", "pgshift-no-such-psql");
        assertThrows(IOException.class, () -> missing.dump(connection, Paths.get("x.sql")));
    }
}
