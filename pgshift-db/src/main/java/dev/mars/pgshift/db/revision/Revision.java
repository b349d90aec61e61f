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

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single migration unit in the revision chain.
 *
 * <p>Revisions are immutable. Their order is defined only by {@link #getParentId()}; the id is
 * an opaque token and is never compared lexically.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class Revision {
    private final String id;
    private final String parentId;
    private final String description;
    private final LocalDate createdOn;
    private final String upScript;
    private final Downgrade downgrade;
    private final boolean transactional;

    private Revision(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Revision id cannot be null");
        this.parentId = builder.parentId;
        this.description = builder.description == null ? "" : builder.description;
        this.createdOn = builder.createdOn;
        this.upScript = Objects.requireNonNull(builder.upScript, "Up script cannot be null for " + builder.id);
        this.downgrade = Objects.requireNonNull(builder.downgrade, "Downgrade cannot be null for " + builder.id);
        this.transactional = builder.transactional;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    /** Returns the preceding revision's id, or null for the root */
    public String getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public String getDescription() {
        return description;
    }

    public LocalDate getCreatedOn() {
        return createdOn;
    }

    public String getUpScript() {
        return upScript;
    }

    public Downgrade getDowngrade() {
        return downgrade;
    }

    public boolean isReversible() {
        return downgrade.isReversible();
    }

    /**
     * Whether the scripts of this revision run inside a transaction. Non-transactional
     * revisions execute their statements in autocommit mode and record the pointer afterwards.
     */
    public boolean isTransactional() {
        return transactional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Revision)) return false;
        Revision other = (Revision) o;
        return id.equals(other.id) && Objects.equals(parentId, other.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId);
    }

    @Override
    public String toString() {
        return "Revision{id='" + id + "', parent='" + parentId + "', description='" + description + "'}";
    }

    /**
     * Builder for Revision.
     */
    public static class Builder {
        private final String id;
        private String parentId;
        private String description;
        private LocalDate createdOn;
        private String upScript;
        private Downgrade downgrade;
        private boolean transactional = true;

        private Builder(String id) {
            this.id = id;
        }

        public Builder parent(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdOn(LocalDate createdOn) {
            this.createdOn = createdOn;
            return this;
        }

        public Builder up(String upScript) {
            this.upScript = upScript;
            return this;
        }

        public Builder down(String downScript) {
            this.downgrade = Downgrade.script(downScript);
            return this;
        }

        public Builder irreversible(String reason) {
            this.downgrade = Downgrade.irreversible(reason);
            return this;
        }

        public Builder transactional(boolean transactional) {
            this.transactional = transactional;
            return this;
        }

        public Revision build() {
            return new Revision(this);
        }
    }
}
