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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgshift.db.exception.InvalidCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a {@link RevisionCatalog} from a versions directory of JSON descriptors and SQL files.
 *
 * <p>Descriptor file names are irrelevant to ordering; they are only sorted so that loading
 * errors are reported deterministically.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class RevisionCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(RevisionCatalogLoader.class);

    static final String DESCRIPTOR_SUFFIX = ".json";

    private final ObjectMapper objectMapper;

    public RevisionCatalogLoader() {
        this(defaultObjectMapper());
    }

    public RevisionCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Loads every descriptor in the directory. A missing directory yields an empty catalog.
     *
     * @param versionsDir directory holding {@code *.json} descriptors and their scripts
     * @return the catalog
     * @throws InvalidCatalogException if a descriptor or script cannot be read, or ids collide
     */
    public RevisionCatalog load(Path versionsDir) {
        if (!Files.isDirectory(versionsDir)) {
            logger.warn("Versions directory not found: {}, using empty revision catalog", versionsDir);
            return RevisionCatalog.empty();
        }

        List<Path> descriptors;
        try (Stream<Path> files = Files.list(versionsDir)) {
            descriptors = files
                .filter(p -> p.getFileName().toString().endsWith(DESCRIPTOR_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new InvalidCatalogException("Cannot list versions directory " + versionsDir, e);
        }

        List<Revision> revisions = new ArrayList<>(descriptors.size());
        for (Path descriptorFile : descriptors) {
            revisions.add(toRevision(versionsDir, descriptorFile, readDescriptor(descriptorFile)));
        }

        RevisionCatalog catalog = new RevisionCatalog(revisions);
        logger.info("Loaded {} revisions from {}", catalog.size(), versionsDir);
        return catalog;
    }

    RevisionDescriptor readDescriptor(Path descriptorFile) {
        try {
            return objectMapper.readValue(descriptorFile.toFile(), RevisionDescriptor.class);
        } catch (IOException e) {
            throw new InvalidCatalogException("Cannot parse revision descriptor " + descriptorFile, e);
        }
    }

    private Revision toRevision(Path versionsDir, Path descriptorFile, RevisionDescriptor descriptor) {
        if (descriptor.id() == null || descriptor.id().isBlank()) {
            throw new InvalidCatalogException("Revision descriptor " + descriptorFile + " has no id");
        }
        if (descriptor.up() == null || descriptor.up().isBlank()) {
            throw new InvalidCatalogException("Revision " + descriptor.id() + " has no up script");
        }
        if (descriptor.down() != null && descriptor.irreversible() != null) {
            throw new InvalidCatalogException("Revision " + descriptor.id()
                + " declares both a down script and an irreversible reason");
        }

        Revision.Builder builder = Revision.builder(descriptor.id())
            .parent(descriptor.parent())
            .description(descriptor.description())
            .createdOn(descriptor.created())
            .up(readScript(versionsDir, descriptor.id(), descriptor.up()))
            .transactional(descriptor.transactionalOrDefault());

        if (descriptor.down() != null) {
            builder.down(readScript(versionsDir, descriptor.id(), descriptor.down()));
        } else if (descriptor.irreversible() != null) {
            builder.irreversible(descriptor.irreversible());
        } else {
            builder.irreversible("no downgrade script provided");
        }

        logger.debug("Loaded revision descriptor: {}", descriptor.id());
        return builder.build();
    }

    private String readScript(Path versionsDir, String revisionId, String fileName) {
        Path script = versionsDir.resolve(fileName);
        try {
            return Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidCatalogException("Cannot read script " + script + " for revision " + revisionId, e);
        }
    }
}
