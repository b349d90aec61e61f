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
import dev.mars.pgshift.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag(TestCategories.CORE)
class MigrationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MigrationMetrics metrics = new MigrationMetrics(registry);

    @Test
    void stepsAreCountedPerDirectionAndOutcome() {
        metrics.recordStep(Environment.DEV, Direction.UP, MigrationMetrics.STEP_COMMITTED);
        metrics.recordStep(Environment.DEV, Direction.UP, MigrationMetrics.STEP_COMMITTED);
        metrics.recordStep(Environment.DEV, Direction.DOWN, MigrationMetrics.STEP_IRREVERSIBLE);

        assertEquals(2.0, metrics.stepCount(Environment.DEV, Direction.UP, MigrationMetrics.STEP_COMMITTED));
        assertEquals(1.0, metrics.stepCount(Environment.DEV, Direction.DOWN, MigrationMetrics.STEP_IRREVERSIBLE));
        assertEquals(0.0, metrics.stepCount(Environment.PROD, Direction.UP, MigrationMetrics.STEP_COMMITTED));
    }

    @Test
    void backupsAreTimedAndDeletionsCounted() {
        metrics.recordBackup(Environment.DEV, false, Duration.ofMillis(250));
        metrics.recordBackupsDeleted(Environment.DEV, 3);

        assertThat(registry.find("pgshift.backup.duration").tag("outcome", "failure").timer().count()).isEqualTo(1);
        assertThat(registry.find("pgshift.backup.deleted").tag("environment", "dev").counter().count()).isEqualTo(3.0);
    }

    @Test
    void summaryTotalsEveryEnvironment() {
        assertThat(metrics.summary()).isEmpty();

        metrics.recordStep(Environment.DEV, Direction.UP, MigrationMetrics.STEP_COMMITTED);
        metrics.recordStep(Environment.PROD, Direction.UP, MigrationMetrics.STEP_COMMITTED);
        metrics.recordStep(Environment.PROD, Direction.DOWN, MigrationMetrics.STEP_FAILED);
        metrics.recordBackup(Environment.DEV, true, Duration.ofSeconds(2));
        metrics.recordBackup(Environment.PROD, false, Duration.ofSeconds(1));
        metrics.recordBackupsDeleted(Environment.DEV, 2);

        assertEquals("steps committed=2 failed=1 irreversible=0, backups succeeded=1 failed=1, backups deleted=2",
            metrics.summary());
    }
}
