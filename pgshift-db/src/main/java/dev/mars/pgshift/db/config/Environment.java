package dev.mars.pgshift.db.config;

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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Logical deployment environments a migration or backup can target. Each one maps to its own
 * set of {@code <ENV>_POSTGRES_*} variables.
 */
public enum Environment {
    PROD,
    STAGE,
    DEV,
    TEST,
    LOCAL;

    /** Lower-case name used on the command line and in backup file names */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Prefix of the connection variables, e.g. {@code DEV_POSTGRES_} */
    public String variablePrefix() {
        return name() + "_POSTGRES_";
    }

    /**
     * Parses a command line environment name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Environment fromId(String id) {
        if (id != null) {
            for (Environment environment : values()) {
                if (environment.id().equalsIgnoreCase(id.trim())) {
                    return environment;
                }
            }
        }
        throw new IllegalArgumentException("Unknown environment '" + id + "', expected one of "
            + Arrays.stream(values()).map(Environment::id).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return id();
    }
}
