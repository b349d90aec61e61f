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
 * Raised when the revision catalog cannot answer a query: unknown ids, broken chains,
 * empty history or unreadable descriptor files.
 */
public class RevisionStoreException extends PgShiftException {

    public RevisionStoreException(String message) {
        super(message);
    }

    public RevisionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
