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
import java.util.Optional;

/**
 * Access to the target database used by the {@link MigrationRunner}: the applied-revision
 * pointer and the execution of migration scripts.
 *
 * <p>Implementations hold a single session for their lifetime. Steps never share a transaction.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public interface SchemaDatabase extends AutoCloseable {

    /**
     * Reads the applied-revision pointer. A missing pointer table, a missing row and a NULL
     * revision all read as empty, meaning no revision is applied.
     */
    Optional<String> readAppliedRevision() throws SQLException;

    /**
     * Runs the work inside one transaction. Commits when the work returns, rolls back and
     * rethrows when it throws.
     */
    <T> T inTransaction(SchemaWork<T> work) throws SQLException;

    /**
     * Runs the work in autocommit mode, each statement committing on its own.
     */
    <T> T withoutTransaction(SchemaWork<T> work) throws SQLException;

    @Override
    void close() throws SQLException;
}
