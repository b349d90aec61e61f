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


import dev.mars.pgshift.db.config.PgConnectionConfig;
import dev.mars.pgshift.db.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link SchemaDatabase} over a single JDBC connection to PostgreSQL.
 *
 * <p>The pointer lives in a single-row table:
 * <pre>
 * CREATE TABLE pgshift_revision (
 *     singleton   BOOLEAN PRIMARY KEY DEFAULT TRUE CHECK (singleton),
 *     revision_id VARCHAR(255),
 *     applied_at  TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT NOW()
 * )
 * </pre>
 * The table is created on the first pointer write, inside that step's transaction.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class JdbcSchemaDatabase implements SchemaDatabase {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaDatabase.class);

    private final PgConnectionConfig connectionConfig;
    private final String pointerTable;
    private final Duration statementTimeout;
    private Connection connection;

    public JdbcSchemaDatabase(PgConnectionConfig connectionConfig, String pointerTable, Duration statementTimeout) {
        SqlIdentifiers.validate(pointerTable, "Pointer table");
        this.connectionConfig = connectionConfig;
        this.pointerTable = pointerTable.trim();
        this.statementTimeout = statementTimeout == null ? Duration.ZERO : statementTimeout;
    }

    @Override
    public Optional<String> readAppliedRevision() throws SQLException {
        Connection conn = connection();
        boolean previousAutoCommit = conn.getAutoCommit();
        conn.setAutoCommit(true);
        try {
            try (PreparedStatement exists = conn.prepareStatement("SELECT to_regclass(?) IS NOT NULL")) {
                exists.setString(1, pointerTable);
                try (ResultSet rs = exists.executeQuery()) {
                    if (!rs.next() || !rs.getBoolean(1)) {
                        logger.debug("Pointer table {} does not exist yet", pointerTable);
                        return Optional.empty();
                    }
                }
            }
            try (Statement statement = conn.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT revision_id FROM " + pointerTable + " WHERE singleton")) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } finally {
            conn.setAutoCommit(previousAutoCommit);
        }
    }

    @Override
    public <T> T inTransaction(SchemaWork<T> work) throws SQLException {
        Connection conn = connection();
        conn.setAutoCommit(false);
        try {
            T result = work.execute(new JdbcSession(conn));
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
                logger.debug("Transaction rolled back");
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    @Override
    public <T> T withoutTransaction(SchemaWork<T> work) throws SQLException {
        Connection conn = connection();
        conn.setAutoCommit(true);
        return work.execute(new JdbcSession(conn));
    }

    @Override
    public void close() throws SQLException {
        if (connection != null) {
            try {
                connection.close();
                logger.debug("Closed connection to {}", connectionConfig);
            } finally {
                connection = null;
            }
        }
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            logger.debug("Opening connection to {}", connectionConfig);
            connection = DriverManager.getConnection(connectionConfig.getJdbcUrl(), connectionConfig.getJdbcProperties());
            connection.setAutoCommit(true);
        }
        return connection;
    }

    private final class JdbcSession implements SchemaSession {
        private final Connection conn;

        private JdbcSession(Connection conn) {
            this.conn = conn;
        }

        @Override
        public void execute(String sql) throws SQLException {
            try (Statement statement = conn.createStatement()) {
                if (!statementTimeout.isZero()) {
                    statement.setQueryTimeout((int) Math.max(1, statementTimeout.toSeconds()));
                }
                statement.execute(sql);
            }
        }

        @Override
        public void writeAppliedRevision(String revisionId) throws SQLException {
            execute("CREATE TABLE IF NOT EXISTS " + pointerTable + " ("
                + "singleton BOOLEAN PRIMARY KEY DEFAULT TRUE CHECK (singleton), "
                + "revision_id VARCHAR(255), "
                + "applied_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT NOW())");

            String upsert = "INSERT INTO " + pointerTable + " (singleton, revision_id, applied_at) VALUES (TRUE, ?, NOW()) "
                + "ON CONFLICT (singleton) DO UPDATE SET revision_id = EXCLUDED.revision_id, applied_at = EXCLUDED.applied_at";
            try (PreparedStatement statement = conn.prepareStatement(upsert)) {
                statement.setString(1, revisionId);
                statement.executeUpdate();
            }
            logger.debug("Applied-revision pointer set to {}", revisionId == null ? "base" : revisionId);
        }
    }
}
