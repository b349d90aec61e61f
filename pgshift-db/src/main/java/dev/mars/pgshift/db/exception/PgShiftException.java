package dev.mars.pgshift.db.exception;

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

/**
 * Base class for every failure raised by the PgShift migration and backup core.
 *
 * <p>All PgShift exceptions are unchecked. They propagate unchanged from the revision store
 * and the backup engine through the migration runner to the command line, which maps each
 * subtype to a distinct exit status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class PgShiftException extends RuntimeException {

    public PgShiftException(String message) {
        super(message);
    }

    public PgShiftException(String message, Throwable cause) {
        super(message, cause);
    }
}
