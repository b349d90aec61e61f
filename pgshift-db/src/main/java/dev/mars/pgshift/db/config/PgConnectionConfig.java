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


import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection parameters for one environment's PostgreSQL database, one field per
 * {@code <ENV>_POSTGRES_*} variable.
 *
 * <p>The same parameters drive both the JDBC connection of the migration runner and the
 * {@code pg_dump}/{@code psql} invocations of the backup engine, so migrations and backups
 * always address the same database.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class PgConnectionConfig {
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;

    private PgConnectionConfig(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.password = builder.password;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * JDBC URL without credentials; those travel in {@link #getJdbcProperties()}.
     */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    public Properties getJdbcProperties() {
        Properties props = new Properties();
        props.setProperty("user", username);
        if (password != null) {
            props.setProperty("password", password);
        }
        return props;
    }

    /**
     * Connection switches for the PostgreSQL client binaries.
     */
    public List<String> getClientArguments() {
        return List.of("-h", host, "-p", String.valueOf(port), "-U", username, "-d", database);
    }

    /**
     * Variables added to a client process environment. The password goes here, never on the
     * command line.
     */
    public Map<String, String> getClientEnvironment() {
        return password == null ? Map.of() : Map.of("PGPASSWORD", password);
    }

    @Override
    public String toString() {
        return username + "@" + host + ":" + port + "/" + database;
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public PgConnectionConfig build() {
            return new PgConnectionConfig(this);
        }
    }
}
