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

import java.util.Objects;

/**
 * How a revision is reverted. A revision is either {@link Reversible} with a down script, or
 * {@link Irreversible} with the reason the downgrade is disallowed. Irreversibility is checked
 * before any transaction is opened, never discovered by running a script that always fails.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public interface Downgrade {

    boolean isReversible();

    static Downgrade script(String script) {
        return new Reversible(script);
    }

    static Downgrade irreversible(String reason) {
        return new Irreversible(reason);
    }

    /**
     * Downgrade applied by executing a SQL script.
     *
     * @param script SQL text executed on {@code down}
     */
    record Reversible(String script) implements Downgrade {
        public Reversible {
            Objects.requireNonNull(script, "Down script cannot be null");
        }

        @Override
        public boolean isReversible() {
            return true;
        }
    }

    /**
     * Downgrade deliberately disallowed.
     *
     * @param reason human-readable rationale reported to the operator
     */
    record Irreversible(String reason) implements Downgrade {
        public Irreversible {
            Objects.requireNonNull(reason, "Irreversible reason cannot be null");
        }

        @Override
        public boolean isReversible() {
            return false;
        }
    }
}
