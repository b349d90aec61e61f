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

import java.io.IOException;
import java.nio.file.Path;

/**
 * The database engine's native dump and restore mechanism.
 *
 * <p>Implementations block until the underlying process exits. A non-zero exit is reported
 * through {@link DumpResult}; {@link IOException} means the process could not be run at all.
 */
public interface DumpTool {

    /**
     * Writes a full schema and data dump of the database to {@code output}.
     */
    DumpResult dump(PgConnectionConfig connection, Path output) throws IOException;

    /**
     * Replays a dump produced by {@link #dump} against the database.
     */
    DumpResult restore(PgConnectionConfig connection, Path input) throws IOException;

    /** Short name recorded in backup manifests */
    String name();
}
