package dev.mars.pgshift.db.revision;

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

import java.time.LocalDate;

/**
 * On-disk form of a revision: one JSON file per revision in the versions directory, naming the
 * script files that sit next to it.
 *
 * <pre>{@code
 * {
 *   "id" : "003_purchased_item_unit",
 *   "parent" : "002_add_identity_providers",
 *   "description" : "Rename purchased_item.quantity_unit to unit and add unit_quantity",
 *   "created" : "2026-02-11",
 *   "up" : "003_purchased_item_unit_up.sql",
 *   "down" : "003_purchased_item_unit_down.sql"
 * }
 * }</pre>
 *
 * <p>{@code down} and {@code irreversible} are mutually exclusive. {@code transactional}
 * defaults to true when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevisionDescriptor(
        @JsonProperty("id") String id,
        @JsonProperty("parent") String parent,
        @JsonProperty("description") String description,
        @JsonProperty("created") LocalDate created,
        @JsonProperty("up") String up,
        @JsonProperty("down") String down,
        @JsonProperty("irreversible") String irreversible,
        @JsonProperty("transactional") Boolean transactional) {

    public boolean transactionalOrDefault() {
        return transactional == null || transactional;
    }
}
