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


import dev.mars.pgshift.db.exception.DisconnectedHistoryException;
import dev.mars.pgshift.db.exception.EmptyHistoryException;
import dev.mars.pgshift.db.exception.InvalidCatalogException;
import dev.mars.pgshift.db.exception.UnknownRevisionException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * In-memory catalog of revisions keyed by id.
 *
 * <p>The catalog is the authoritative ordering of migrations: order follows parent links only.
 * Construction rejects duplicate ids but otherwise accepts malformed input, because catalogs
 * are loaded from files that can be edited by hand. Broken chains surface as
 * {@link DisconnectedHistoryException} from the queries that depend on them, and
 * {@link #validate()} lists every problem at once.
 *
 * <p>All operations are pure functions over the loaded revisions; none of them touch the
 * database or the file system.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class RevisionCatalog {

    /** Target name for the state before the root revision (no revision applied). */
    public static final String BASE = "base";

    private final Map<String, Revision> revisions;

    public RevisionCatalog(Collection<Revision> revisions) {
        Map<String, Revision> byId = new LinkedHashMap<>();
        for (Revision revision : revisions) {
            if (BASE.equals(revision.getId())) {
                throw new InvalidCatalogException("Revision id '" + BASE + "' is reserved");
            }
            Revision previous = byId.putIfAbsent(revision.getId(), revision);
            if (previous != null) {
                throw new InvalidCatalogException("Duplicate revision id: " + revision.getId());
            }
        }
        this.revisions = Collections.unmodifiableMap(byId);
    }

    public static RevisionCatalog empty() {
        return new RevisionCatalog(List.of());
    }

    /**
     * Returns true when the id names the base state: null or {@value #BASE}.
     */
    public static boolean isBase(String revisionId) {
        return revisionId == null || BASE.equals(revisionId);
    }

    public boolean isEmpty() {
        return revisions.isEmpty();
    }

    public int size() {
        return revisions.size();
    }

    public boolean contains(String revisionId) {
        return revisionId != null && revisions.containsKey(revisionId);
    }

    /**
     * Returns the revision with the given id.
     *
     * @throws UnknownRevisionException if the id is not in the catalog
     */
    public Revision get(String revisionId) {
        Revision revision = revisionId == null ? null : revisions.get(revisionId);
        if (revision == null) {
            throw new UnknownRevisionException(revisionId);
        }
        return revision;
    }

    /**
     * Returns the id of the latest revision, the one no other revision names as parent.
     *
     * @throws EmptyHistoryException if the catalog is empty
     * @throws DisconnectedHistoryException if there is not exactly one head
     */
    public String head() {
        if (revisions.isEmpty()) {
            throw new EmptyHistoryException();
        }
        List<String> heads = findHeads();
        if (heads.size() != 1) {
            throw new DisconnectedHistoryException("Expected a single head revision but found " + heads);
        }
        return heads.get(0);
    }

    /**
     * Returns the revisions from root to head. The returned iterable is lazy and can be
     * iterated any number of times; each iteration walks the chain again.
     *
     * @throws DisconnectedHistoryException during iteration if the chain is not a single line
     */
    public Iterable<Revision> history() {
        return HistoryIterator::new;
    }

    /**
     * Resolves the ordered steps that move the schema from {@code currentId} to {@code targetId}.
     * Either id may be null or {@value #BASE}.
     *
     * <p>A descendant target yields ascending {@link Direction#UP} steps. An ancestor target yields
     * descending {@link Direction#DOWN} steps, one per revision being reverted. Equal ids yield an
     * empty path.
     *
     * @throws UnknownRevisionException if either id is not in the catalog
     * @throws DisconnectedHistoryException if no chain connects the two revisions
     */
    public List<MigrationStep> resolvePath(String currentId, String targetId) {
        String current = isBase(currentId) ? null : currentId;
        String target = isBase(targetId) ? null : targetId;

        if (current != null && !revisions.containsKey(current)) {
            throw new UnknownRevisionException(current);
        }
        if (target != null && !revisions.containsKey(target)) {
            throw new UnknownRevisionException(target);
        }
        if (Objects.equals(current, target)) {
            return List.of();
        }

        // Forward: the current revision is an ancestor of the target
        if (target != null) {
            Ancestry ancestry = ancestry(target);
            int index = current == null ? -1 : ancestry.indexOf(current);
            if (index >= 0 || (current == null && ancestry.reachesRoot())) {
                List<Revision> pending = index >= 0
                    ? new ArrayList<>(ancestry.revisions().subList(0, index))
                    : new ArrayList<>(ancestry.revisions());
                Collections.reverse(pending);
                return toSteps(pending, Direction.UP);
            }
        }

        // Reverse: the target is an ancestor of the current revision
        if (current != null) {
            Ancestry ancestry = ancestry(current);
            int index = target == null ? -1 : ancestry.indexOf(target);
            if (index >= 0) {
                return toSteps(ancestry.revisions().subList(0, index), Direction.DOWN);
            }
            if (target == null && ancestry.reachesRoot()) {
                return toSteps(ancestry.revisions(), Direction.DOWN);
            }
        }

        throw new DisconnectedHistoryException("No path between " + describe(current) + " and " + describe(target));
    }

    /**
     * Checks the single-chain invariants and returns one message per violation. An empty list
     * means the catalog is a well-formed chain (or is empty).
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (revisions.isEmpty()) {
            return problems;
        }

        for (Revision revision : revisions.values()) {
            if (revision.getParentId() != null && !revisions.containsKey(revision.getParentId())) {
                problems.add("Revision " + revision.getId() + " references unknown parent " + revision.getParentId());
            }
        }

        List<String> roots = revisions.values().stream()
            .filter(Revision::isRoot)
            .map(Revision::getId)
            .collect(Collectors.toList());
        if (roots.size() != 1) {
            problems.add("Expected a single root revision but found " + roots);
        }

        List<String> heads = findHeads();
        if (heads.size() != 1) {
            problems.add("Expected a single head revision but found " + heads);
        }

        Map<String, List<String>> children = childrenByParent();
        children.forEach((parent, ids) -> {
            if (ids.size() > 1) {
                problems.add("Revision " + parent + " has multiple children " + ids);
            }
        });

        if (roots.size() == 1) {
            Set<String> reachable = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>(List.of(roots.get(0)));
            while (!pending.isEmpty()) {
                String id = pending.pop();
                if (reachable.add(id)) {
                    pending.addAll(children.getOrDefault(id, List.of()));
                }
            }
            if (reachable.size() < revisions.size()) {
                List<String> unreachable = revisions.keySet().stream()
                    .filter(id -> !reachable.contains(id))
                    .sorted()
                    .collect(Collectors.toList());
                problems.add("Revisions not reachable from root " + roots.get(0) + " (cycle or detached chain): " + unreachable);
            }
        }

        return problems;
    }

    private List<String> findHeads() {
        Set<String> parents = revisions.values().stream()
            .map(Revision::getParentId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        return revisions.keySet().stream()
            .filter(id -> !parents.contains(id))
            .collect(Collectors.toList());
    }

    private Map<String, List<String>> childrenByParent() {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (Revision revision : revisions.values()) {
            if (revision.getParentId() != null) {
                children.computeIfAbsent(revision.getParentId(), k -> new ArrayList<>()).add(revision.getId());
            }
        }
        return children;
    }

    /**
     * Walks parent links from the given revision towards the root.
     */
    private Ancestry ancestry(String fromId) {
        List<Revision> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String id = fromId;
        while (id != null) {
            Revision revision = revisions.get(id);
            if (revision == null) {
                return new Ancestry(chain, false);
            }
            if (!seen.add(id)) {
                throw new DisconnectedHistoryException("Cycle detected in revision history at " + id);
            }
            chain.add(revision);
            id = revision.getParentId();
        }
        return new Ancestry(chain, true);
    }

    private static List<MigrationStep> toSteps(List<Revision> ordered, Direction direction) {
        List<MigrationStep> steps = new ArrayList<>(ordered.size());
        for (Revision revision : ordered) {
            steps.add(new MigrationStep(revision, direction));
        }
        return Collections.unmodifiableList(steps);
    }

    private static String describe(String id) {
        return id == null ? BASE : id;
    }

    /**
     * Revisions from a starting point to the root, nearest first.
     *
     * @param revisions the visited revisions, starting revision first
     * @param reachesRoot false when the walk stopped at a parent id missing from the catalog
     */
    private record Ancestry(List<Revision> revisions, boolean reachesRoot) {
        int indexOf(String id) {
            for (int i = 0; i < revisions.size(); i++) {
                if (revisions.get(i).getId().equals(id)) {
                    return i;
                }
            }
            return -1;
        }
    }

    private final class HistoryIterator implements Iterator<Revision> {
        private final Map<String, List<String>> children = childrenByParent();
        private final Set<String> visited = new HashSet<>();
        private Revision next;

        HistoryIterator() {
            if (revisions.isEmpty()) {
                return;
            }
            List<Revision> roots = revisions.values().stream()
                .filter(Revision::isRoot)
                .collect(Collectors.toList());
            if (roots.size() != 1) {
                throw new DisconnectedHistoryException("Expected a single root revision but found "
                    + roots.stream().map(Revision::getId).collect(Collectors.toList()));
            }
            next = roots.get(0);
        }

        @Override
        public boolean hasNext() {
            if (next == null && visited.size() != revisions.size()) {
                throw new DisconnectedHistoryException(
                    (revisions.size() - visited.size()) + " revision(s) are not on the chain from the root");
            }
            return next != null;
        }

        @Override
        public Revision next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Revision current = next;
            visited.add(current.getId());
            List<String> followers = children.getOrDefault(current.getId(), List.of());
            if (followers.size() > 1) {
                throw new DisconnectedHistoryException("Revision " + current.getId() + " has multiple children " + followers);
            }
            next = followers.isEmpty() ? null : revisions.get(followers.get(0));
            return current;
        }
    }
}
