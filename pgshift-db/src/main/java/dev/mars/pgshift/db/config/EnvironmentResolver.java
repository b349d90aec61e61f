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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Resolves an environment's connection parameters from {@code <ENV>_POSTGRES_HOST},
 * {@code _PORT}, {@code _DB}, {@code _USER} and {@code _PASSWORD} variables.
 *
 * <p>The variable map is injected; the command line passes {@link System#getenv()}, tests pass
 * a literal map.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class EnvironmentResolver {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentResolver.class);

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 5432;
    static final String DEFAULT_USER = "postgres";
    static final String DEFAULT_PASSWORD = "postgres";

    private final Map<String, String> variables;

    public EnvironmentResolver(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    /**
     * Builds the connection configuration for an environment.
     *
     * @throws IllegalStateException if the database name is missing or the port is not a number
     */
    public PgConnectionConfig resolve(Environment environment) {
        String prefix = environment.variablePrefix();

        String database = variables.get(prefix + "DB");
        if (database == null || database.isBlank()) {
            throw new IllegalStateException("Required environment variable not set: " + prefix + "DB");
        }

        int port;
        String portValue = variables.get(prefix + "PORT");
        try {
            port = portValue == null || portValue.isBlank() ? DEFAULT_PORT : Integer.parseInt(portValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid port in " + prefix + "PORT: " + portValue, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalStateException("Database port must be between 1 and 65535: " + port);
        }

        PgConnectionConfig config = new PgConnectionConfig.Builder()
            .host(valueOrDefault(prefix + "HOST", DEFAULT_HOST))
            .port(port)
            .database(database.trim())
            .username(valueOrDefault(prefix + "USER", DEFAULT_USER))
            .password(valueOrDefault(prefix + "PASSWORD", DEFAULT_PASSWORD))
            .build();

        logger.debug("Resolved connection for environment {}: {}", environment, config);
        return config;
    }

    private String valueOrDefault(String key, String defaultValue) {
        String value = variables.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
