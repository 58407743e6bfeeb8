package com.codeops.workbench.storage;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.config.WorkbenchProperties;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.CollectionIndexEntry;
import com.codeops.workbench.exception.StorageException;
import com.codeops.workbench.storage.migration.DocumentKind;
import com.codeops.workbench.storage.migration.MigrateContext;
import com.codeops.workbench.storage.migration.StorageMigration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores the collections index and each collection as pretty-printed JSON files under
 * {@code <dataDir>/collections}. Every file is wrapped in a {@link StorageFile} envelope
 * carrying its schema version; older content is migrated on read and written back.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonFileStorage implements CollectionStorage {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final ObjectMapper objectMapper;
    private final WorkbenchProperties properties;
    private final List<StorageMigration> migrations;

    @Override
    public Optional<List<CollectionIndexEntry>> loadIndex() {
        Path file = collectionsDir().resolve(AppConstants.INDEX_FILE_NAME);
        return read(file, DocumentKind.INDEX)
                .map(content -> convert(file, content, new TypeReference<List<CollectionIndexEntry>>() {}));
    }

    @Override
    public void saveIndex(List<CollectionIndexEntry> entries) {
        write(collectionsDir().resolve(AppConstants.INDEX_FILE_NAME), DocumentKind.INDEX,
                objectMapper.valueToTree(entries));
    }

    @Override
    public Optional<Collection> load(String collectionId) {
        Path file = collectionFile(collectionId);
        return read(file, DocumentKind.COLLECTION)
                .map(content -> convert(file, content, new TypeReference<Collection>() {}));
    }

    @Override
    public void save(Collection collection) {
        write(collectionFile(collection.getId()), DocumentKind.COLLECTION, objectMapper.valueToTree(collection));
        log.debug("Saved collection {} to disk", collection.getId());
    }

    @Override
    public void delete(String collectionId) {
        Path file = collectionFile(collectionId);
        try {
            Files.deleteIfExists(file);
            log.info("Deleted collection file {}", file);
        } catch (IOException e) {
            log.error("Failed to delete collection file {}", file, e);
            throw new StorageException("Failed to delete collection file " + file, e);
        }
    }

    /**
     * Reads and migrates one file. A missing file, or a file without a readable envelope,
     * yields empty so that callers fall back to initial state. A file from a newer schema
     * version is refused and left untouched.
     */
    private Optional<JsonNode> read(Path file, DocumentKind kind) {
        StorageFile stored;
        try {
            stored = objectMapper.readValue(Files.readAllBytes(file), StorageFile.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.error("Failed to parse {}, ignoring its content", file, e);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read {}", file, e);
            throw new StorageException("Failed to read " + file, e);
        }
        if (stored == null || stored.header() == null) {
            log.error("File {} has no storage header, ignoring its content", file);
            return Optional.empty();
        }

        int version = stored.header().version();
        JsonNode content = stored.content();
        if (version == kind.currentVersion()) {
            return Optional.ofNullable(content);
        }
        if (version > kind.currentVersion()) {
            log.error("File {} has version {}, newer than the supported {}", file, version, kind.currentVersion());
            throw new StorageException("File " + file + " was written by a newer version (" + version
                    + " > " + kind.currentVersion() + ")");
        }
        log.info("Migrating {} from version {} to {}", file, version, kind.currentVersion());
        List<StorageMigration> pending = migrations.stream()
                .filter(m -> m.kind() == kind && m.version() > version && m.version() <= kind.currentVersion())
                .sorted(Comparator.comparingInt(StorageMigration::version))
                .toList();
        for (StorageMigration migration : pending) {
            content = migration.migrate(new MigrateContext(file.getFileName().toString(), version, content));
        }
        write(file, kind, content);
        return Optional.ofNullable(content);
    }

    private <T> T convert(Path file, JsonNode content, TypeReference<T> type) {
        try {
            return objectMapper.readerFor(type).readValue(content);
        } catch (IOException e) {
            log.error("Content of {} does not match the expected shape", file, e);
            throw new StorageException("Content of " + file + " does not match the expected shape", e);
        }
    }

    private void write(Path file, DocumentKind kind, JsonNode content) {
        StorageFile stored = new StorageFile(new StorageFile.Header(kind.currentVersion(), Instant.now()), content);
        try {
            Files.createDirectories(file.getParent());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(stored));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to write {}", file, e);
            throw new StorageException("Failed to write " + file, e);
        }
    }

    private Path collectionsDir() {
        return properties.getDataDir().resolve(AppConstants.COLLECTIONS_DIR);
    }

    private Path collectionFile(String collectionId) {
        if (collectionId == null || !SAFE_ID.matcher(collectionId).matches() || collectionId.startsWith(".")) {
            throw new StorageException("Illegal collection id for storage: " + collectionId);
        }
        return collectionsDir().resolve(collectionId + ".json");
    }
}
