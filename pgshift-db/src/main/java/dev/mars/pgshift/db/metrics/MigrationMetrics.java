package dev.mars.pgshift.db.metrics;

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

import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.revision.Direction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer instrumentation for migration steps and backups.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code pgshift.migration.steps} counter, tags {@code environment}, {@code direction},
 *       {@code outcome} (committed, failed, irreversible)</li>
 *   <li>{@code pgshift.backup.duration} timer, tags {@code environment}, {@code outcome}
 *       (success, failure)</li>
 *   <li>{@code pgshift.backup.deleted} counter, tag {@code environment}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class MigrationMetrics {

    public static final String STEP_COMMITTED = "committed";
    public static final String STEP_FAILED = "failed";
    public static final String STEP_IRREVERSIBLE = "irreversible";

    private static final String STEPS = "pgshift.migration.steps";
    private static final String BACKUP_DURATION = "pgshift.backup.duration";
    private static final String BACKUPS_DELETED = "pgshift.backup.deleted";

    private final MeterRegistry registry;

    public MigrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by a private in-memory registry, for callers that do not export metrics.
     */
    public static MigrationMetrics inMemory() {
        return new MigrationMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordStep(Environment environment, Direction direction, String outcome) {
        Counter.builder(STEPS)
            .description("Migration steps attempted, by outcome")
            .tag("environment", environment.id())
            .tag("direction", direction.label())
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    public void recordBackup(Environment environment, boolean success, Duration duration) {
        Timer.builder(BACKUP_DURATION)
            .description("Time taken by pg_dump backups")
            .tag("environment", environment.id())
            .tag("outcome", success ? "success" : "failure")
            .register(registry)
            .record(duration);
    }

    public void recordBackupsDeleted(Environment environment, int count) {
        Counter.builder(BACKUPS_DELETED)
            .description("Backups removed by retention cleanup")
            .tag("environment", environment.id())
            .register(registry)
            .increment(count);
    }

    /**
     * Returns how many steps were recorded with the given tags; zero if none.
     */
    public double stepCount(Environment environment, Direction direction, String outcome) {
        Counter counter = registry.find(STEPS)
            .tag("environment", environment.id())
            .tag("direction", direction.label())
            .tag("outcome", outcome)
            .counter();
        return counter == null ? 0 : counter.count();
    }

    /**
     * One line totalling everything recorded so far across environments; empty when nothing was.
     */
    public String summary() {
        if (registry.getMeters().isEmpty()) {
            return "";
        }
        return String.format("steps committed=%d failed=%d irreversible=%d, backups succeeded=%d failed=%d, backups deleted=%d",
            stepTotal(STEP_COMMITTED), stepTotal(STEP_FAILED), stepTotal(STEP_IRREVERSIBLE),
            backupTotal("success"), backupTotal("failure"),
            (long) registry.find(BACKUPS_DELETED).counters().stream().mapToDouble(Counter::count).sum());
    }

    private long stepTotal(String outcome) {
        return (long) registry.find(STEPS).tag("outcome", outcome).counters().stream()
            .mapToDouble(Counter::count).sum();
    }

    private long backupTotal(String outcome) {
        return registry.find(BACKUP_DURATION).tag("outcome", outcome).timers().stream()
            .mapToLong(Timer::count).sum();
    }
}
