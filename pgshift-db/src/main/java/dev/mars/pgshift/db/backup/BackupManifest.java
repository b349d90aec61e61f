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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * JSON sidecar written next to every dump ({@code <dump>.json}). Restore refuses dumps whose
 * manifest is missing or names a different environment or database.
 *
 * @param environment environment id the dump was taken from
 * @param database database name
 * @param host database host
 * @param createdAt creation time in UTC
 * @param appliedRevision applied-revision pointer at backup time, null if unknown or base
 * @param tool dump command that produced the file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackupManifest(
        @JsonProperty("environment") String environment,
        @JsonProperty("database") String database,
        @JsonProperty("host") String host,
        @JsonProperty("createdAt") LocalDateTime createdAt,
        @JsonProperty("appliedRevision") String appliedRevision,
        @JsonProperty("tool") String tool) {
}
