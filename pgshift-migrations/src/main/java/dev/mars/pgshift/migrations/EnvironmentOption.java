package dev.mars.pgshift.migrations;

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
import picocli.CommandLine;

/**
 * Shared {@code --env} option selecting the target environment.
 */
public class EnvironmentOption {

    @CommandLine.Option(names = {"-e", "--env"}, required = true, converter = EnvironmentConverter.class,
            description = "Target environment: prod, stage, dev, test or local")
    Environment environment;

    public Environment get() {
        return environment;
    }

    static class EnvironmentConverter implements CommandLine.ITypeConverter<Environment> {
        @Override
        public Environment convert(String value) {
            try {
                return Environment.fromId(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
