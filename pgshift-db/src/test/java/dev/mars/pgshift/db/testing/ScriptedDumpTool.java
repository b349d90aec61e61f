package dev.mars.pgshift.db.testing;

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


import dev.mars.pgshift.db.backup.DumpResult;
import dev.mars.pgshift.db.backup.DumpTool;
import dev.mars.pgshift.db.config.PgConnectionConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DumpTool} fake. By default a dump writes a small SQL file and exits 0; it can be told
 * to exit non-zero (optionally leaving partial output behind) or to fail to start.
 */
public class ScriptedDumpTool implements DumpTool {

    private final List<Path> dumps = new ArrayList<>();
    private final List<Path> restores = new ArrayList<>();
    private int dumpExitStatus;
    private int restoreExitStatus;
    private String errorOutput = "";
    private boolean writePartialOutput;
    private boolean notInstalled;
    private RuntimeException crash;

    public ScriptedDumpTool failDumps(int exitStatus, String errorOutput) {
        this.dumpExitStatus = exitStatus;
        this.errorOutput = errorOutput;
        return this;
    }

    public ScriptedDumpTool failRestores(int exitStatus, String errorOutput) {
        this.restoreExitStatus = exitStatus;
        this.errorOutput = errorOutput;
        return this;
    }

    public ScriptedDumpTool leavePartialOutput() {
        this.writePartialOutput = true;
        return this;
    }

    /**
     * Makes the next dumps write partial output and then throw instead of returning a result.
     */
    public ScriptedDumpTool crashDuringDump(RuntimeException crash) {
        this.crash = crash;
        return this;
    }

    public ScriptedDumpTool notInstalled() {
        this.notInstalled = true;
        return this;
    }

    @Override
    public DumpResult dump(PgConnectionConfig connection, Path output) throws IOException {
        if (notInstalled) {
            throw new IOException("Cannot run program \"pg_dump\": error=2, No such file or directory");
        }
        dumps.add(output);
        if (crash != null) {
            Files.writeString(output, "-- PostgreSQL database dump, truncated\n", StandardCharsets.UTF_8);
            throw crash;
        }
        if (dumpExitStatus == 0 || writePartialOutput) {
            Files.writeString(output, "-- PostgreSQL database dump of " + connection.getDatabase() + "\n",
                StandardCharsets.UTF_8);
        }
        return new DumpResult(dumpExitStatus, dumpExitStatus == 0 ? "" : errorOutput);
    }

    @Override
    public DumpResult restore(PgConnectionConfig connection, Path input) throws IOException {
        if (notInstalled) {
            throw new IOException("Cannot run program \"psql\": error=2, No such file or directory");
        }
        restores.add(input);
        return new DumpResult(restoreExitStatus, restoreExitStatus == 0 ? "" : errorOutput);
    }

    @Override
    public String name() {
        return "scripted";
    }

    public List<Path> getDumps() {
        return List.copyOf(dumps);
    }

    public List<Path> getRestores() {
        return List.copyOf(restores);
    }
}
