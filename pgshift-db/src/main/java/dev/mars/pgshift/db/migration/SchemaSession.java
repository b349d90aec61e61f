package dev.mars.pgshift.db.migration;

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


import java.sql.SQLException;

/**
 * Operations available to a {@link SchemaWork} while it runs.
 */
public interface SchemaSession {

    /**
     * Executes one SQL statement.
     */
    void execute(String sql) throws SQLException;

    /**
     * Upserts the applied-revision pointer, creating the pointer table when needed.
     *
     * @param revisionId the applied revision, or null for base
     */
    void writeAppliedRevision(String revisionId) throws SQLException;
}
