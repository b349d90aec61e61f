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
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.exception.DatabaseAccessException;
import dev.mars.pgshift.db.exception.IrreversibleMigrationException;
import dev.mars.pgshift.db.exception.MigrationException;
import dev.mars.pgshift.db.exception.MigrationStepFailedException;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import dev.mars.pgshift.db.revision.Direction;
import dev.mars.pgshift.db.revision.Downgrade;
import dev.mars.pgshift.db.revision.MigrationStep;
import dev.mars.pgshift.db.revision.Revision;
import dev.mars.pgshift.db.revision.RevisionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives upgrades and downgrades of one environment's schema along the revision chain.
 *
 * <p>A run resolves the path from the applied-revision pointer to the target, optionally takes a
 * backup, then applies each step in its own transaction together with the pointer update. A
 * failing step is rolled back on its own; steps committed before it stay applied, so running the
 * same request again resumes from the pointer. Nothing is retried.
 *
 * <p>The runner performs no locking. Running two migrations against the same database at the
 * same time is the operator's responsibility to prevent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    private final Environment environment;
    private final RevisionCatalog catalog;
    private final SchemaDatabase database;
    private final BackupService backupService;
    private final MigrationMetrics metrics;
    private final MigrationListener listener;
    private MigrationState state = MigrationState.IDLE;

    public MigrationRunner(Environment environment, RevisionCatalog catalog, SchemaDatabase database,
                           BackupService backupService, MigrationMetrics metrics) {
        this(environment, catalog, database, backupService, metrics, MigrationListener.NONE);
    }

    public MigrationRunner(Environment environment, RevisionCatalog catalog, SchemaDatabase database,
                           BackupService backupService, MigrationMetrics metrics, MigrationListener listener) {
        this.environment = environment;
        this.catalog = catalog;
        this.database = database;
        this.backupService = backupService;
        this.metrics = metrics;
        this.listener = listener == null ? MigrationListener.NONE : listener;
    }

    /**
     * Applies revisions up to the request's target, or to head when none is given.
     *
     * @throws IllegalArgumentException if the target is an ancestor of the current revision
     * @throws dev.mars.pgshift.db.exception.BackupFailedException if the required backup fails; no
     *         script has run
     * @throws MigrationStepFailedException if a step fails; earlier steps stay committed
     */
    public MigrationResult upgrade(MigrationRequest request) {
        transition(MigrationState.RESOLVING_PATH, null);
        String current = null;
        try {
            current = readPointer();
            String target = request.target();
            if (target == null) {
                target = catalog.isEmpty() ? RevisionCatalog.BASE : catalog.head();
            }
            List<MigrationStep> path = catalog.resolvePath(current, target);
            if (!path.isEmpty() && path.get(0).direction() != Direction.UP) {
                throw new IllegalArgumentException("Target " + target + " is behind the current revision "
                    + describe(current) + "; use down to revert");
            }
            logger.info("Upgrading {} from {} to {} ({} step(s))", environment, describe(current), target, path.size());
            return run(Direction.UP, current, path, request.backupPolicy());
        } catch (RuntimeException e) {
            fail(e, current);
            throw e;
        }
    }

    /**
     * Reverts revisions down to the request's target, or one revision back when none is given.
     * At base this is a no-op.
     *
     * @throws IllegalArgumentException if the target is a descendant of the current revision
     * @throws IrreversibleMigrationException if a revision on the path cannot be downgraded;
     *         revisions reverted before it stay reverted
     * @throws MigrationStepFailedException if a step fails; earlier steps stay committed
     */
    public MigrationResult downgrade(MigrationRequest request) {
        transition(MigrationState.RESOLVING_PATH, null);
        String current = null;
        try {
            current = readPointer();
            String target = request.target();
            if (target == null) {
                if (current == null) {
                    logger.info("{} is at base, nothing to downgrade", environment);
                    return run(Direction.DOWN, null, List.of(), request.backupPolicy());
                }
                target = describe(catalog.get(current).getParentId());
            }
            List<MigrationStep> path = catalog.resolvePath(current, target);
            if (!path.isEmpty() && path.get(0).direction() != Direction.DOWN) {
                throw new IllegalArgumentException("Target " + target + " is ahead of the current revision "
                    + describe(current) + "; use up to apply");
            }
            logger.info("Downgrading {} from {} to {} ({} step(s))", environment, describe(current), target, path.size());
            return run(Direction.DOWN, current, path, request.backupPolicy());
        } catch (RuntimeException e) {
            fail(e, current);
            throw e;
        }
    }

    /**
     * Returns the applied revision, empty at base. Reads the pointer only.
     *
     * @throws DatabaseAccessException if the pointer cannot be read
     */
    public Optional<String> current() {
        return Optional.ofNullable(readPointer());
    }

    /**
     * Returns the catalog's revisions from root to head. Does not touch the database.
     */
    public Iterable<Revision> history() {
        return catalog.history();
    }

    public MigrationState getState() {
        return state;
    }

    public Environment getEnvironment() {
        return environment;
    }

    private MigrationResult run(Direction direction, String start, List<MigrationStep> path, BackupPolicy policy) {
        if (path.isEmpty()) {
            logger.info("{} is already at target {}", environment, describe(start));
            transition(MigrationState.DONE, null);
            return new MigrationResult(environment, direction, start, start, List.of(), null);
        }

        BackupRecord backup = null;
        if (policy == BackupPolicy.REQUIRED) {
            transition(MigrationState.BACKING_UP, null);
            backup = backupService.backup(environment, start);
            logger.info("Pre-migration backup stored at {}", backup.path());
        } else {
            logger.warn("Skipping pre-migration backup for {}", environment);
        }

        String pointer = start;
        List<String> applied = new ArrayList<>(path.size());
        for (MigrationStep step : path) {
            transition(MigrationState.APPLYING_STEP, step);
            applyStep(step, pointer);
            pointer = step.resultingRevisionId();
            applied.add(step.revisionId());
            metrics.recordStep(environment, step.direction(), MigrationMetrics.STEP_COMMITTED);
            logger.info("Committed {} {} (now at {})", step.direction().label(), step.revisionId(), describe(pointer));
            transition(MigrationState.COMMITTED, step);
        }

        transition(MigrationState.DONE, null);
        logger.info("Migration of {} completed: {} -> {}, {} revision(s)", environment, describe(start),
            describe(pointer), applied.size());
        return new MigrationResult(environment, direction, start, pointer, applied, backup);
    }

    private void applyStep(MigrationStep step, String pointer) {
        Revision revision = step.revision();
        String script;
        if (step.direction() == Direction.UP) {
            script = revision.getUpScript();
        } else {
            Downgrade downgrade = revision.getDowngrade();
            if (downgrade instanceof Downgrade.Irreversible irreversible) {
                metrics.recordStep(environment, step.direction(), MigrationMetrics.STEP_IRREVERSIBLE);
                throw new IrreversibleMigrationException(revision.getId(), pointer, irreversible.reason());
            }
            script = ((Downgrade.Reversible) downgrade).script();
        }

        List<String> statements = SqlScriptParser.split(script);
        String resulting = step.resultingRevisionId();
        logger.debug("Applying {} {}: {} statement(s)", step.direction().label(), revision.getId(), statements.size());

        try {
            if (revision.isTransactional()) {
                database.inTransaction(session -> {
                    executeAll(session, statements);
                    session.writeAppliedRevision(resulting);
                    return null;
                });
            } else {
                database.withoutTransaction(session -> {
                    executeAll(session, statements);
                    return null;
                });
                database.inTransaction(session -> {
                    session.writeAppliedRevision(resulting);
                    return null;
                });
            }
        } catch (SQLException e) {
            metrics.recordStep(environment, step.direction(), MigrationMetrics.STEP_FAILED);
            throw new MigrationStepFailedException(revision.getId(), step.direction(), pointer, e);
        }
    }

    private static void executeAll(SchemaSession session, List<String> statements) throws SQLException {
        for (String statement : statements) {
            session.execute(statement);
        }
    }

    private String readPointer() {
        try {
            return database.readAppliedRevision().orElse(null);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Cannot read the applied revision of " + environment
                + ": " + e.getMessage(), e);
        }
    }

    private void fail(RuntimeException e, String startPointer) {
        String lastApplied = e instanceof MigrationException migrationError && migrationError.getRevisionId() != null
            ? migrationError.getLastAppliedRevision()
            : startPointer;
        logger.error("Migration of {} failed in state {} (last applied revision: {}): {}",
            environment, state, describe(lastApplied), e.getMessage());
        transition(MigrationState.FAILED, null);
    }

    private void transition(MigrationState next, MigrationStep step) {
        logger.debug("{}: {} -> {}{}", environment, state, next, step == null ? "" : " [" + step.revisionId() + "]");
        state = next;
        listener.onStateChange(next, step);
    }

    private static String describe(String revisionId) {
        return revisionId == null ? RevisionCatalog.BASE : revisionId;
    }
}
