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


import dev.mars.pgshift.db.backup.BackupService;
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.config.PgConnectionConfig;
import dev.mars.pgshift.db.exception.MigrationStepFailedException;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import dev.mars.pgshift.db.revision.Revision;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import dev.mars.pgshift.test.PostgreSQLTestConstants;
import dev.mars.pgshift.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Runs migrations against a real PostgreSQL to verify transactional behaviour of the pointer
 * table and scripts.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers
class JdbcSchemaDatabaseIntegrationTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaDatabaseIntegrationTest.class);

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private JdbcSchemaDatabase database;
    private final BackupService backups = mock(BackupService.class);

    @BeforeEach
    void setUp() throws SQLException {
        logger.info("PostgreSQL container: {}", postgres.getJdbcUrl());
        try (Connection conn = connect(); Statement statement = conn.createStatement()) {
            statement.execute("DROP SCHEMA public CASCADE");
            statement.execute("CREATE SCHEMA public");
        }
        database = new JdbcSchemaDatabase(connectionConfig(), "pgshift_revision", Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() throws SQLException {
        database.close();
    }

    @Test
    void freshDatabaseIsAtBase() throws SQLException {
        assertThat(database.readAppliedRevision()).isEmpty();
        assertFalse(tableExists("pgshift_revision"));
    }

    @Test
    void upgradeAndDowngradeMaintainSingleRowPointer() throws SQLException {
        MigrationRunner runner = runner(receiptCatalog());

        runner.upgrade(MigrationRequest.toDefault().withoutBackup());

        assertThat(database.readAppliedRevision()).contains("002_purchased_item_unit");
        assertTrue(tableExists("purchased_item"));
        assertEquals(1, count("SELECT COUNT(*) FROM pgshift_revision"));
        assertEquals(1, count("SELECT COUNT(*) FROM information_schema.columns "
            + "WHERE table_name = 'purchased_item' AND column_name = 'unit_quantity'"));

        runner.downgrade(MigrationRequest.to(RevisionCatalog.BASE).withoutBackup());

        assertThat(database.readAppliedRevision()).isEmpty();
        assertFalse(tableExists("purchased_item"));
        assertEquals(1, count("SELECT COUNT(*) FROM pgshift_revision WHERE revision_id IS NULL"));
        verifyNoInteractions(backups);
    }

    @Test
    void failingStepRollsBackItsOwnStatementsOnly() throws SQLException {
        Revision broken = Revision.builder("003_broken")
            .parent("002_purchased_item_unit")
            .up("CREATE TABLE half_done (id INTEGER);\nSELECT * FROM table_that_does_not_exist;")
            .down("DROP TABLE half_done;")
            .build();
        List<Revision> revisions = new ArrayList<>();
        receiptCatalog().history().forEach(revisions::add);
        revisions.add(broken);
        MigrationRunner runner = runner(new RevisionCatalog(revisions));

        MigrationStepFailedException e = assertThrows(MigrationStepFailedException.class,
            () -> runner.upgrade(MigrationRequest.toDefault().withoutBackup()));

        assertEquals("003_broken", e.getRevisionId());
        assertThat(e.getCause()).isInstanceOf(SQLException.class);
        assertThat(database.readAppliedRevision()).contains("002_purchased_item_unit");
        assertFalse(tableExists("half_done"));
        assertTrue(tableExists("purchased_item"));
    }

    @Test
    void nullOnlyShopIdConversionAbortsOnExistingValues() throws SQLException {
        Revision shopId = Revision.builder("003_receipt_shop_id_int")
            .parent("002_purchased_item_unit")
            .up("""
                DO $$
                BEGIN
                    IF EXISTS (SELECT 1 FROM receipt WHERE shop_id IS NOT NULL) THEN
                        RAISE EXCEPTION 'Migration aborted: receipt.shop_id contains non-NULL values';
                    END IF;
                END
                $$;
                ALTER TABLE receipt ALTER COLUMN shop_id TYPE INTEGER USING NULL::INTEGER;
                """)
            .down("ALTER TABLE receipt ALTER COLUMN shop_id TYPE UUID USING NULL::UUID;")
            .build();
        List<Revision> revisions = new ArrayList<>();
        receiptCatalog().history().forEach(revisions::add);
        revisions.add(shopId);
        MigrationRunner runner = runner(new RevisionCatalog(revisions));
        runner.upgrade(MigrationRequest.to("002_purchased_item_unit").withoutBackup());
        try (Connection conn = connect(); Statement statement = conn.createStatement()) {
            statement.execute("INSERT INTO receipt (id, shop_id) VALUES (gen_random_uuid(), gen_random_uuid())");
        }

        assertThrows(MigrationStepFailedException.class,
            () -> runner.upgrade(MigrationRequest.toDefault().withoutBackup()));
        assertThat(database.readAppliedRevision()).contains("002_purchased_item_unit");

        try (Connection conn = connect(); Statement statement = conn.createStatement()) {
            statement.execute("UPDATE receipt SET shop_id = NULL");
        }
        runner.upgrade(MigrationRequest.toDefault().withoutBackup());
        assertThat(database.readAppliedRevision()).contains("003_receipt_shop_id_int");
    }

    @Test
    void nonTransactionalRevisionCanAddEnumValues() throws SQLException {
        Revision enumType = Revision.builder("001_identity_provider")
            .up("CREATE TYPE identity_provider AS ENUM ('google');")
            .down("DROP TYPE identity_provider;")
            .build();
        Revision addValues = Revision.builder("002_add_identity_providers")
            .parent("001_identity_provider")
            .up("ALTER TYPE identity_provider ADD VALUE IF NOT EXISTS 'telegram';\n"
                + "ALTER TYPE identity_provider ADD VALUE IF NOT EXISTS 'appwrite';")
            .irreversible("PostgreSQL cannot drop enum values")
            .transactional(false)
            .build();

        runner(new RevisionCatalog(List.of(enumType, addValues))).upgrade(MigrationRequest.toDefault().withoutBackup());

        assertThat(database.readAppliedRevision()).contains("002_add_identity_providers");
        assertEquals(3, count("SELECT COUNT(*) FROM pg_enum e JOIN pg_type t ON t.oid = e.enumtypid "
            + "WHERE t.typname = 'identity_provider'"));
    }

    @Test
    void invalidPointerTableNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new JdbcSchemaDatabase(connectionConfig(), "pgshift; DROP TABLE receipt", Duration.ZERO));
    }

    private MigrationRunner runner(RevisionCatalog catalog) {
        return new MigrationRunner(Environment.TEST, catalog, database, backups, MigrationMetrics.inMemory());
    }

    private static RevisionCatalog receiptCatalog() {
        Revision initial = Revision.builder("001_initial_schema")
            .up("""
                CREATE TABLE receipt (id UUID PRIMARY KEY, shop_id UUID);
                CREATE TABLE purchased_item (
                    id SERIAL PRIMARY KEY,
                    receipt_id UUID REFERENCES receipt (id),
                    quantity_unit VARCHAR(16)
                );
                """)
            .down("DROP TABLE purchased_item;\nDROP TABLE receipt;")
            .build();
        Revision unit = Revision.builder("002_purchased_item_unit")
            .parent("001_initial_schema")
            .up("""
                ALTER TABLE purchased_item
                    RENAME COLUMN quantity_unit TO unit;

                ALTER TABLE purchased_item
                    ADD COLUMN unit_quantity DECIMAL(12, 3);
                """)
            .down("""
                ALTER TABLE purchased_item
                    RENAME COLUMN unit TO quantity_unit;

                ALTER TABLE purchased_item
                    DROP COLUMN unit_quantity;
                """)
            .build();
        return new RevisionCatalog(List.of(initial, unit));
    }

    private static PgConnectionConfig connectionConfig() {
        return new PgConnectionConfig.Builder()
            .host(postgres.getHost())
            .port(postgres.getFirstMappedPort())
            .database(postgres.getDatabaseName())
            .username(postgres.getUsername())
            .password(postgres.getPassword())
            .build();
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    private static boolean tableExists(String table) throws SQLException {
        return count("SELECT COUNT(*) FROM information_schema.tables WHERE table_name = '" + table + "'") > 0;
    }

    private static int count(String sql) throws SQLException {
        try (Connection conn = connect(); Statement statement = conn.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
