package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.document.ExportedCollection;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.StorageException;
import com.codeops.workbench.storage.CollectionSanitizer;
import com.codeops.workbench.store.CollectionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Produces native export documents. Exported collections are sanitized the same way
 * as persisted ones, so secrets never leave the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExportService {

    private final CollectionStore collectionStore;
    private final CollectionSanitizer sanitizer;
    private final ObjectMapper objectMapper;

    /**
     * Exports a collection as a native document.
     *
     * @param collectionId the collection
     * @return the export document
     * @throws NotFoundException if the collection does not exist
     */
    public ExportedCollection exportCollection(String collectionId) {
        ExportedCollection document = new ExportedCollection(
                AppConstants.EXPORT_FORMAT,
                AppConstants.EXPORT_VERSION,
                Instant.now(),
                sanitizer.sanitize(collectionStore.snapshot(collectionId)));
        log.info("Exported collection {}", collectionId);
        return document;
    }

    /**
     * Serializes an export document as pretty-printed JSON.
     *
     * @param document the document
     * @return the JSON text
     * @throws StorageException if serialization fails
     */
    public String toJson(ExportedCollection document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize export document", e);
            throw new StorageException("Failed to serialize export document", e);
        }
    }
}
