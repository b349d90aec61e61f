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
 * Thrown when a revision id is not present in the catalog.
 */
public class UnknownRevisionException extends RevisionStoreException {

    private final String revisionId;

    public UnknownRevisionException(String revisionId) {
        super("Unknown revision: " + revisionId);
        this.revisionId = revisionId;
    }

    /** Returns the id that could not be found */
    public String getRevisionId() { return revisionId; }
}
