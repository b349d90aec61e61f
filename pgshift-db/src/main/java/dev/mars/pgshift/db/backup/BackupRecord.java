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

import dev.mars.pgshift.db.config.Environment;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A dump file written by the backup engine. Records are never mutated; retention cleanup
 * deletes whole files.
 *
 * @param path location of the dump
 * @param environment environment the dump was taken from
 * @param createdAt creation time in UTC, as encoded in the file name
 * @param sizeBytes size of the dump file
 */
public record BackupRecord(Path path, Environment environment, LocalDateTime createdAt, long sizeBytes) {
}
