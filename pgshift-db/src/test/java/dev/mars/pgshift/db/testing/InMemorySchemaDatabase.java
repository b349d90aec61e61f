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


import dev.mars.pgshift.db.migration.SchemaDatabase;
import dev.mars.pgshift.db.migration.SchemaSession;
import dev.mars.pgshift.db.migration.SchemaWork;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SchemaDatabase} fake that records statements instead of running them.
 *
 * <p>Statements and pointer writes made inside {@link #inTransaction} only become visible when
 * the work completes; a failure discards them, as a rollback would. Statements containing a
 * configured fragment fail with an {@link SQLException}. A lost connection makes every later call
 * fail with SQLState {@code 08006}.
 */
public class InMemorySchemaDatabase implements SchemaDatabase {

    private final List<String> committedStatements = new ArrayList<>();
    private final List<String> failingFragments = new ArrayList<>();
    private final List<String> connectionLossFragments = new ArrayList<>();
    private boolean connectionLost;
    private String appliedRevision;
    private int transactions;
    private int rollbacks;
    private int pointerWrites;
    private boolean closed;

    public InMemorySchemaDatabase() {
    }

    public InMemorySchemaDatabase(String appliedRevision) {
        this.appliedRevision = appliedRevision;
    }

    /**
     * Makes every statement containing the fragment fail.
     */
    public InMemorySchemaDatabase failOn(String fragment) {
        failingFragments.add(fragment);
        return this;
    }

    /**
     * Drops the connection when a statement containing the fragment runs.
     */
    public InMemorySchemaDatabase loseConnectionOn(String fragment) {
        connectionLossFragments.add(fragment);
        return this;
    }

    public void clearFailures() {
        failingFragments.clear();
    }

    @Override
    public Optional<String> readAppliedRevision() throws SQLException {
        checkConnection();
        return Optional.ofNullable(appliedRevision);
    }

    @Override
    public <T> T inTransaction(SchemaWork<T> work) throws SQLException {
        checkConnection();
        transactions++;
        RecordingSession session = new RecordingSession();
        try {
            T result = work.execute(session);
            committedStatements.addAll(session.statements);
            if (session.pointerWritten) {
                appliedRevision = session.pointer;
                pointerWrites++;
            }
            return result;
        } catch (SQLException | RuntimeException e) {
            rollbacks++;
            throw e;
        }
    }

    @Override
    public <T> T withoutTransaction(SchemaWork<T> work) throws SQLException {
        checkConnection();
        SchemaSession autocommit = new SchemaSession() {
            @Override
            public void execute(String sql) throws SQLException {
                check(sql);
                committedStatements.add(sql);
            }

            @Override
            public void writeAppliedRevision(String revisionId) {
                appliedRevision = revisionId;
                pointerWrites++;
            }
        };
        return work.execute(autocommit);
    }

    @Override
    public void close() {
        closed = true;
    }

    public String getAppliedRevision() {
        return appliedRevision;
    }

    public List<String> getCommittedStatements() {
        return List.copyOf(committedStatements);
    }

    public int getTransactions() {
        return transactions;
    }

    public int getRollbacks() {
        return rollbacks;
    }

    public int getPointerWrites() {
        return pointerWrites;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkConnection() throws SQLException {
        if (connectionLost) {
            throw new SQLException("This connection has been closed.", "08003");
        }
    }

    private void check(String sql) throws SQLException {
        for (String fragment : connectionLossFragments) {
            if (sql.contains(fragment)) {
                connectionLost = true;
                throw new SQLException("An I/O error occurred while sending to the backend.", "08006");
            }
        }
        for (String fragment : failingFragments) {
            if (sql.contains(fragment)) {
                throw new SQLException("simulated failure executing: " + sql, "42P01");
            }
        }
    }

    private final class RecordingSession implements SchemaSession {
        private final List<String> statements = new ArrayList<>();
        private boolean pointerWritten;
        private String pointer;

        @Override
        public void execute(String sql) throws SQLException {
            check(sql);
            statements.add(sql);
        }

        @Override
        public void writeAppliedRevision(String revisionId) {
            pointerWritten = true;
            pointer = revisionId;
        }
    }
}
