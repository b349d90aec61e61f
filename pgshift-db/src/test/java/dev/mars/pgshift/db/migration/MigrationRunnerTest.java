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


import dev.mars.pgshift.db.backup.BackupRecord;
import dev.mars.pgshift.db.backup.BackupService;
import dev.mars.pgshift.db.backup.PgDumpBackupService;
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.config.PgConnectionConfig;
import dev.mars.pgshift.db.exception.BackupFailedException;
import dev.mars.pgshift.db.exception.DatabaseAccessException;
import dev.mars.pgshift.db.exception.IrreversibleMigrationException;
import dev.mars.pgshift.db.exception.MigrationStepFailedException;
import dev.mars.pgshift.db.exception.UnknownRevisionException;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import dev.mars.pgshift.db.revision.Direction;
import dev.mars.pgshift.db.revision.Revision;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import dev.mars.pgshift.db.testing.InMemorySchemaDatabase;
import dev.mars.pgshift.db.testing.SampleRevisions;
import dev.mars.pgshift.db.testing.ScriptedDumpTool;
import dev.mars.pgshift.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static dev.mars.pgshift.db.testing.SampleRevisions.irreversible;
import static dev.mars.pgshift.db.testing.SampleRevisions.reversible;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag(TestCategories.CORE)
class MigrationRunnerTest {

    @TempDir
    Path backupDir;

    private final RevisionCatalog catalog = SampleRevisions.chain("root", "A", "B", "C");
    private ScriptedDumpTool dumpTool;
    private PgDumpBackupService backupService;
    private MigrationMetrics metrics;
    private List<MigrationState> states;

    @BeforeEach
    void setUp() {
        dumpTool = new ScriptedDumpTool();
        metrics = MigrationMetrics.inMemory();
        backupService = new PgDumpBackupService(backupDir, dumpTool,
            env -> new PgConnectionConfig.Builder().database("receipts_dev").username("postgres").build(),
            Clock.systemUTC(), metrics);
        states = new ArrayList<>();
    }

    @Test
    void upgradeFromEmptyDatabaseAppliesEveryRevisionAfterOneBackup() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase();

        MigrationResult result = runner(catalog, database).upgrade(MigrationRequest.toDefault());

        assertEquals("C", database.getAppliedRevision());
        assertThat(database.getCommittedStatements()).containsExactly(
            "CREATE TABLE t_root (id INTEGER)", "CREATE TABLE t_a (id INTEGER)",
            "CREATE TABLE t_b (id INTEGER)", "CREATE TABLE t_c (id INTEGER)");
        assertThat(result.appliedRevisions()).containsExactly("root", "A", "B", "C");
        assertNull(result.fromRevision());
        assertEquals("C", result.toRevision());
        assertEquals(Direction.UP, result.direction());

        assertThat(dumpTool.getDumps()).hasSize(1);
        assertThat(result.getBackup()).isPresent();
        assertThat(states.indexOf(MigrationState.BACKING_UP)).isLessThan(states.indexOf(MigrationState.APPLYING_STEP));
        assertEquals(4.0, metrics.stepCount(Environment.DEV, Direction.UP, MigrationMetrics.STEP_COMMITTED));
    }

    @Test
    void downgradeToAncestorRevertsInReverseOrder() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");

        MigrationResult result = runner(catalog, database).downgrade(MigrationRequest.to("A"));

        assertEquals("A", database.getAppliedRevision());
        assertThat(database.getCommittedStatements()).containsExactly("DROP TABLE t_c", "DROP TABLE t_b");
        assertThat(result.appliedRevisions()).containsExactly("C", "B");
        assertEquals("A", result.toRevision());
    }

    @Test
    void irreversibleRevisionStopsDowngradeAfterEarlierSteps() {
        RevisionCatalog withIrreversible = new RevisionCatalog(List.of(
            reversible("root", null),
            reversible("A", "root"),
            irreversible("B", "A", "PostgreSQL cannot drop enum values"),
            reversible("C", "B")));
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");
        MigrationRunner runner = runner(withIrreversible, database);

        IrreversibleMigrationException e = assertThrows(IrreversibleMigrationException.class,
            () -> runner.downgrade(MigrationRequest.to("root")));

        assertEquals("B", e.getRevisionId());
        assertEquals("B", e.getLastAppliedRevision());
        assertEquals("PostgreSQL cannot drop enum values", e.getReason());
        assertEquals("B", database.getAppliedRevision());
        assertThat(database.getCommittedStatements()).containsExactly("DROP TABLE t_c");
        assertEquals(1, database.getTransactions());
        assertEquals(MigrationState.FAILED, runner.getState());
        assertEquals(1.0, metrics.stepCount(Environment.DEV, Direction.DOWN, MigrationMetrics.STEP_IRREVERSIBLE));
    }

    @Test
    void irreversibleRevisionAtTopLeavesPointerUnchanged() {
        RevisionCatalog withIrreversible = new RevisionCatalog(List.of(
            reversible("root", null), irreversible("A", "root", "data is dropped")));
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("A");

        assertThrows(IrreversibleMigrationException.class,
            () -> runner(withIrreversible, database).downgrade(MigrationRequest.toDefault().withoutBackup()));

        assertEquals("A", database.getAppliedRevision());
        assertEquals(0, database.getTransactions());
    }

    @Test
    void failedBackupPreventsEveryScript() {
        BackupService failingBackups = mock(BackupService.class);
        BackupFailedException failure = new BackupFailedException("dev", 1, "pg_dump: error: permission denied");
        when(failingBackups.backup(eq(Environment.DEV), any())).thenThrow(failure);
        InMemorySchemaDatabase database = new InMemorySchemaDatabase();
        MigrationRunner runner = new MigrationRunner(Environment.DEV, catalog, database, failingBackups, metrics);

        BackupFailedException thrown = assertThrows(BackupFailedException.class,
            () -> runner.upgrade(MigrationRequest.toDefault()));

        assertSame(failure, thrown);
        assertThat(database.getCommittedStatements()).isEmpty();
        assertEquals(0, database.getTransactions());
        assertNull(database.getAppliedRevision());
        assertEquals(MigrationState.FAILED, runner.getState());
    }

    @Test
    void backupRecordsThePointerAtBackupTime() {
        BackupService backups = mock(BackupService.class);
        when(backups.backup(Environment.DEV, "A")).thenReturn(
            new BackupRecord(backupDir.resolve("dev_20260217_093000_000.sql"), Environment.DEV,
                LocalDateTime.of(2026, 2, 17, 9, 30), 128L));
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("A");

        new MigrationRunner(Environment.DEV, catalog, database, backups, metrics).upgrade(MigrationRequest.toDefault());

        verify(backups).backup(Environment.DEV, "A");
    }

    @Test
    void roundTripFromHeadToBaseAndBack() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");
        MigrationRunner runner = runner(catalog, database);

        MigrationResult down = runner.downgrade(MigrationRequest.to(RevisionCatalog.BASE).withoutBackup());
        assertNull(database.getAppliedRevision());
        assertThat(down.appliedRevisions()).containsExactly("C", "B", "A", "root");
        assertEquals("base", down.describeTo());

        runner.upgrade(MigrationRequest.toDefault().withoutBackup());
        assertEquals("C", database.getAppliedRevision());
    }

    @Test
    void failedStepKeepsEarlierStepsAndResumes() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase().failOn("t_b");
        MigrationRunner runner = runner(catalog, database);

        MigrationStepFailedException e = assertThrows(MigrationStepFailedException.class,
            () -> runner.upgrade(MigrationRequest.toDefault().withoutBackup()));

        assertEquals("B", e.getRevisionId());
        assertEquals(Direction.UP, e.getDirection());
        assertEquals("A", e.getLastAppliedRevision());
        assertThat(e.getCause()).isInstanceOf(SQLException.class);
        assertEquals("A", database.getAppliedRevision());
        assertEquals(1, database.getRollbacks());
        assertEquals(1.0, metrics.stepCount(Environment.DEV, Direction.UP, MigrationMetrics.STEP_FAILED));

        database.clearFailures();
        MigrationResult resumed = runner.upgrade(MigrationRequest.toDefault().withoutBackup());

        assertThat(resumed.appliedRevisions()).containsExactly("B", "C");
        assertEquals("A", resumed.fromRevision());
        assertEquals("C", database.getAppliedRevision());
        assertThat(database.getCommittedStatements()).containsExactly(
            "CREATE TABLE t_root (id INTEGER)", "CREATE TABLE t_a (id INTEGER)",
            "CREATE TABLE t_b (id INTEGER)", "CREATE TABLE t_c (id INTEGER)");
    }

    @Test
    void lostConnectionFailsTheStepAndLaterReadsAsDatabaseAccess() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase().loseConnectionOn("t_b");
        MigrationRunner runner = runner(catalog, database);

        MigrationStepFailedException e = assertThrows(MigrationStepFailedException.class,
            () -> runner.upgrade(MigrationRequest.toDefault().withoutBackup()));
        assertEquals("B", e.getRevisionId());
        assertEquals("A", e.getLastAppliedRevision());

        DatabaseAccessException readError = assertThrows(DatabaseAccessException.class, runner::current);
        assertThat(readError).hasCauseInstanceOf(SQLException.class);
        assertThat(((SQLException) readError.getCause()).getSQLState()).isEqualTo("08003");
        assertThrows(DatabaseAccessException.class, () -> runner.upgrade(MigrationRequest.toDefault().withoutBackup()));
        assertEquals(MigrationState.FAILED, runner.getState());
    }

    @Test
    void skippingBackupCreatesNoFileButMigratesTheSame() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase();

        MigrationResult result = runner(catalog, database).upgrade(MigrationRequest.toDefault().withoutBackup());

        assertThat(dumpTool.getDumps()).isEmpty();
        assertThat(backupService.list(Environment.DEV)).isEmpty();
        assertThat(result.getBackup()).isEmpty();
        assertEquals("C", database.getAppliedRevision());
        assertThat(states).doesNotContain(MigrationState.BACKING_UP);
    }

    @Test
    void alreadyAtTargetTakesNoBackup() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");

        MigrationResult result = runner(catalog, database).upgrade(MigrationRequest.toDefault());

        assertTrue(result.isAlreadyAtTarget());
        assertThat(dumpTool.getDumps()).isEmpty();
        assertEquals(0, database.getTransactions());
        assertThat(states).containsExactly(MigrationState.RESOLVING_PATH, MigrationState.DONE);
    }

    @Test
    void upgradeRefusesAncestorTarget() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");

        assertThrows(IllegalArgumentException.class, () -> runner(catalog, database).upgrade(MigrationRequest.to("A")));
        assertThat(dumpTool.getDumps()).isEmpty();
        assertEquals("C", database.getAppliedRevision());
    }

    @Test
    void downgradeDefaultsToOneStepBack() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("C");

        MigrationResult result = runner(catalog, database).downgrade(MigrationRequest.toDefault());

        assertThat(result.appliedRevisions()).containsExactly("C");
        assertEquals("B", database.getAppliedRevision());
    }

    @Test
    void downgradeAtBaseIsANoOp() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase();

        MigrationResult result = runner(catalog, database).downgrade(MigrationRequest.toDefault());

        assertTrue(result.isAlreadyAtTarget());
        assertThat(dumpTool.getDumps()).isEmpty();
        assertNull(database.getAppliedRevision());
    }

    @Test
    void downgradeRefusesDescendantTarget() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("A");

        assertThrows(IllegalArgumentException.class, () -> runner(catalog, database).downgrade(MigrationRequest.to("C")));
    }

    @Test
    void pointerToUnknownRevisionFails() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("Z");

        assertThrows(UnknownRevisionException.class, () -> runner(catalog, database).upgrade(MigrationRequest.toDefault()));
        assertThat(dumpTool.getDumps()).isEmpty();
    }

    @Test
    void nonTransactionalRevisionWritesPointerSeparately() {
        Revision enumChange = Revision.builder("A")
            .parent("root")
            .up("ALTER TYPE identity_provider ADD VALUE IF NOT EXISTS 'telegram';\n"
                + "ALTER TYPE identity_provider ADD VALUE IF NOT EXISTS 'appwrite';")
            .irreversible("PostgreSQL cannot drop enum values")
            .transactional(false)
            .build();
        RevisionCatalog catalog = new RevisionCatalog(List.of(reversible("root", null), enumChange));
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("root");

        runner(catalog, database).upgrade(MigrationRequest.toDefault().withoutBackup());

        assertEquals("A", database.getAppliedRevision());
        assertThat(database.getCommittedStatements()).hasSize(2);
        assertEquals(1, database.getTransactions());
    }

    @Test
    void listenerSeesEveryTransitionInOrder() {
        InMemorySchemaDatabase database = new InMemorySchemaDatabase("A");

        runner(catalog, database).upgrade(MigrationRequest.toDefault());

        assertThat(states).containsExactly(
            MigrationState.RESOLVING_PATH,
            MigrationState.BACKING_UP,
            MigrationState.APPLYING_STEP, MigrationState.COMMITTED,
            MigrationState.APPLYING_STEP, MigrationState.COMMITTED,
            MigrationState.DONE);
    }

    @Test
    void currentAndHistoryNeverTouchBackups() {
        BackupService backups = mock(BackupService.class);
        MigrationRunner runner = new MigrationRunner(Environment.DEV, catalog, new InMemorySchemaDatabase("B"),
            backups, metrics);

        assertThat(runner.current()).contains("B");
        assertThat(runner.history()).extracting(Revision::getId).containsExactly("root", "A", "B", "C");
        verifyNoInteractions(backups);
    }

    private MigrationRunner runner(RevisionCatalog catalog, InMemorySchemaDatabase database) {
        return new MigrationRunner(Environment.DEV, catalog, database, backupService, metrics,
            (state, step) -> states.add(state));
    }
}
