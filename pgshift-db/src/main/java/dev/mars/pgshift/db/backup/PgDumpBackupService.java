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


import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgshift.db.config.Environment;
import dev.mars.pgshift.db.config.PgConnectionConfig;
import dev.mars.pgshift.db.exception.BackupException;
import dev.mars.pgshift.db.exception.BackupFailedException;
import dev.mars.pgshift.db.exception.BackupNotFoundException;
import dev.mars.pgshift.db.exception.RestoreFailedException;
import dev.mars.pgshift.db.metrics.MigrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Backup engine storing {@code pg_dump} output under a backups directory.
 *
 * <p>Dump files are named {@code <environment>_<yyyyMMdd_HHmmss_SSS>.sql} with the timestamp in
 * UTC, so names keep sorting in creation order across daylight saving changes. Ordering and
 * retention use the timestamp in the name, never file modification times. Each dump gets a JSON manifest
 * ({@link BackupManifest}) written after the dump succeeds; a dump without a manifest is never
 * restored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class PgDumpBackupService implements BackupService {
    private static final Logger logger = LoggerFactory.getLogger(PgDumpBackupService.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final Pattern DUMP_NAME = Pattern.compile("^([a-z]+)_(\\d{8}_\\d{6}_\\d{3})\\.sql$");
    static final String MANIFEST_SUFFIX = ".json";

    private final Path backupDir;
    private final DumpTool dumpTool;
    private final Function<Environment, PgConnectionConfig> connections;
    private final Clock clock;
    private final MigrationMetrics metrics;
    private final ObjectMapper objectMapper;

    public PgDumpBackupService(Path backupDir, DumpTool dumpTool,
                               Function<Environment, PgConnectionConfig> connections,
                               Clock clock, MigrationMetrics metrics) {
        this.backupDir = backupDir;
        this.dumpTool = dumpTool;
        this.connections = connections;
        this.clock = clock;
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public BackupRecord backup(Environment environment, String appliedRevision) {
        PgConnectionConfig connection = connections.apply(environment);
        LocalDateTime createdAt = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        Path dumpFile = backupDir.resolve(fileName(environment, createdAt));

        if (Files.exists(dumpFile)) {
            throw new BackupFailedException(environment.id(), BackupFailedException.NOT_STARTED,
                "backup file already exists: " + dumpFile);
        }

        logger.info("Creating backup for {} ({}): {}", environment, connection, dumpFile);
        long start = System.nanoTime();
        try {
            Files.createDirectories(backupDir);
            DumpResult result;
            try {
                result = dumpTool.dump(connection, dumpFile);
            } catch (IOException e) {
                throw new BackupFailedException(environment.id(), BackupFailedException.NOT_STARTED,
                    "could not run " + dumpTool.name() + ": " + e.getMessage(), e);
            }
            if (!result.isSuccess()) {
                throw new BackupFailedException(environment.id(), result.exitStatus(), result.errorOutput());
            }

            long size = Files.exists(dumpFile) ? Files.size(dumpFile) : 0L;
            if (size == 0L) {
                throw new BackupFailedException(environment.id(), result.exitStatus(), "dump output is empty");
            }

            BackupManifest manifest = new BackupManifest(environment.id(), connection.getDatabase(),
                connection.getHost(), createdAt, appliedRevision, dumpTool.name());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(manifestFile(dumpFile).toFile(), manifest);

            metrics.recordBackup(environment, true, Duration.ofNanos(System.nanoTime() - start));
            logger.info("Backup created successfully: {} ({} bytes)", dumpFile, size);
            return new BackupRecord(dumpFile, environment, createdAt, size);
        } catch (BackupFailedException e) {
            discard(dumpFile);
            metrics.recordBackup(environment, false, Duration.ofNanos(System.nanoTime() - start));
            logger.error("Backup failed for {}: {}", environment, e.getMessage());
            throw e;
        } catch (IOException e) {
            discard(dumpFile);
            metrics.recordBackup(environment, false, Duration.ofNanos(System.nanoTime() - start));
            logger.error("Backup failed for {}", environment, e);
            throw new BackupFailedException(environment.id(), BackupFailedException.NOT_STARTED,
                "I/O error writing " + dumpFile + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            discard(dumpFile);
            metrics.recordBackup(environment, false, Duration.ofNanos(System.nanoTime() - start));
            logger.error("Backup failed for {}", environment, e);
            throw new BackupFailedException(environment.id(), BackupFailedException.NOT_STARTED,
                dumpTool.name() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<BackupRecord> list(Environment environment) {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files
                .map(path -> toRecord(path).orElse(null))
                .filter(record -> record != null && record.environment() == environment)
                .sorted(Comparator.comparing(BackupRecord::createdAt).reversed())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BackupException("Cannot list backups in " + backupDir, e);
        }
    }

    @Override
    public void restore(Environment environment, Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BackupNotFoundException(path, "file does not exist");
        }
        BackupRecord record = toRecord(path)
            .filter(r -> r.environment() == environment)
            .orElseThrow(() -> new BackupNotFoundException(path, "not a dump for environment " + environment));

        Path manifestFile = manifestFile(path);
        if (!Files.isRegularFile(manifestFile)) {
            throw new BackupNotFoundException(path, "manifest " + manifestFile.getFileName() + " is missing");
        }

        PgConnectionConfig connection = connections.apply(environment);
        BackupManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestFile.toFile(), BackupManifest.class);
        } catch (IOException e) {
            throw new BackupNotFoundException(path, "manifest is unreadable: " + e.getMessage());
        }
        if (!environment.id().equals(manifest.environment())) {
            throw new BackupNotFoundException(path, "taken from environment " + manifest.environment());
        }
        if (!connection.getDatabase().equals(manifest.database())) {
            throw new BackupNotFoundException(path, "taken from database " + manifest.database()
                + ", target is " + connection.getDatabase());
        }

        logger.info("Restoring backup {} (taken {}) into {} ({})", path, record.createdAt(), environment, connection);
        DumpResult result;
        try {
            result = dumpTool.restore(connection, path);
        } catch (IOException e) {
            throw new RestoreFailedException(path, "could not run restore: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            logger.error("Restore of {} failed with exit status {}", path, result.exitStatus());
            throw new RestoreFailedException(path, result.exitStatus(), result.errorOutput());
        }
        logger.info("Backup restored successfully from: {}", path);
    }

    @Override
    public List<BackupRecord> cleanup(Environment environment, int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be a non-negative integer, was " + keep);
        }

        List<BackupRecord> records = list(environment);
        if (records.size() <= keep) {
            logger.info("Nothing to clean up for {}: {} backup(s), keeping {}", environment, records.size(), keep);
            return List.of();
        }

        List<BackupRecord> removed = new ArrayList<>(records.subList(keep, records.size()));
        for (BackupRecord record : removed) {
            logger.info("Removing old backup: {}", record.path());
            try {
                Files.deleteIfExists(record.path());
                Files.deleteIfExists(manifestFile(record.path()));
            } catch (IOException e) {
                throw new BackupException("Cannot delete backup " + record.path(), e);
            }
        }
        metrics.recordBackupsDeleted(environment, removed.size());
        return removed;
    }

    static String fileName(Environment environment, LocalDateTime createdAt) {
        return environment.id() + "_" + TIMESTAMP.format(createdAt) + ".sql";
    }

    private static Path manifestFile(Path dumpFile) {
        return dumpFile.resolveSibling(dumpFile.getFileName() + MANIFEST_SUFFIX);
    }

    private Optional<BackupRecord> toRecord(Path path) {
        Matcher matcher = DUMP_NAME.matcher(path.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Environment environment;
        try {
            environment = Environment.fromId(matcher.group(1));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        LocalDateTime createdAt = LocalDateTime.parse(matcher.group(2), TIMESTAMP);
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            size = 0L;
        }
        return Optional.of(new BackupRecord(path, environment, createdAt, size));
    }

    private static void discard(Path dumpFile) {
        try {
            Files.deleteIfExists(dumpFile);
        } catch (IOException e) {
            logger.warn("Could not remove partial dump {}", dumpFile, e);
        }
    }
}
