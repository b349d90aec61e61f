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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgshift.db.exception.InvalidCatalogException;
import dev.mars.pgshift.db.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Appends a new templated revision to a versions directory.
 *
 * <p>The new revision's parent is always the current head, so the catalog stays a single chain.
 * Ids take the form {@code NNN_slug}: the numeric prefix of the head plus one, zero padded.
 */
public class RevisionWriter {
    private static final Logger logger = LoggerFactory.getLogger(RevisionWriter.class);

    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^(\\d+)_");

    private final ObjectMapper objectMapper;

    public RevisionWriter() {
        this(RevisionCatalogLoader.defaultObjectMapper());
    }

    public RevisionWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes descriptor, up and down template files for a new revision.
     *
     * @param versionsDir target directory, created if missing
     * @param catalog the catalog currently stored in that directory
     * @param message human-readable description, also used for the slug
     * @param createdOn creation date recorded in the descriptor
     * @return the revision as it would be loaded back
     * @throws IllegalArgumentException if the message yields an empty slug
     * @throws InvalidCatalogException if the catalog is malformed or the files already exist
     */
    public Revision create(Path versionsDir, RevisionCatalog catalog, String message, LocalDate createdOn) {
        String slug = SqlIdentifiers.slugify(message);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Migration message must contain letters or digits: '" + message + "'");
        }

        List<String> problems = catalog.validate();
        if (!problems.isEmpty()) {
            throw new InvalidCatalogException("Refusing to append to a malformed catalog: " + String.join("; ", problems));
        }

        String parent = catalog.isEmpty() ? null : catalog.head();
        String id = String.format("%03d_%s", nextSequence(catalog, parent), slug);
        if (catalog.contains(id)) {
            throw new InvalidCatalogException("Revision already exists: " + id);
        }

        String upFile = id + "_up.sql";
        String downFile = id + "_down.sql";
        String upScript = "-- " + message.trim() + "\n\n";
        String downScript = "-- Revert: " + message.trim() + "\n\n";
        RevisionDescriptor descriptor = new RevisionDescriptor(
            id, parent, message.trim(), createdOn, upFile, downFile, null, null);

        try {
            Files.createDirectories(versionsDir);
            writeNew(versionsDir.resolve(upFile), upScript);
            writeNew(versionsDir.resolve(downFile), downScript);
            writeNew(versionsDir.resolve(id + RevisionCatalogLoader.DESCRIPTOR_SUFFIX),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(descriptor));
        } catch (IOException e) {
            throw new InvalidCatalogException("Cannot write revision " + id + " to " + versionsDir, e);
        }

        logger.info("Created revision {} (parent: {})", id, parent == null ? RevisionCatalog.BASE : parent);
        return Revision.builder(id)
            .parent(parent)
            .description(message.trim())
            .createdOn(createdOn)
            .up(upScript)
            .down(downScript)
            .build();
    }

    static int nextSequence(RevisionCatalog catalog, String headId) {
        if (headId == null) {
            return 1;
        }
        Matcher matcher = NUMERIC_PREFIX.matcher(headId);
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1)) + 1;
        }
        return catalog.size() + 1;
    }

    private static void writeNew(Path file, String content) throws IOException {
        if (Files.exists(file)) {
            throw new InvalidCatalogException("Refusing to overwrite existing file " + file);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
