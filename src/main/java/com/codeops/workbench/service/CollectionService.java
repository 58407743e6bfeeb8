package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.document.ExportedCollection;
import com.codeops.workbench.dto.mapper.CollectionMapper;
import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.request.UpdateCollectionRequest;
import com.codeops.workbench.dto.response.CollectionSummaryResponse;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.enums.AuthType;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for collection lifecycle: listing, creation, metadata updates, removal,
 * ordering, duplication and the scratch collection.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Validated
public class CollectionService {

    private final CollectionStore collectionStore;
    private final EffectiveViewCache effectiveViewCache;
    private final IdGenerator idGenerator;
    private final CollectionMapper collectionMapper;
    private final ExportService exportService;
    private final ImportService importService;

    /**
     * Lists all collections, scratch first and then in user order.
     *
     * @return the collection summaries
     */
    public List<CollectionSummaryResponse> listCollections() {
        return collectionStore.listIndex().stream().map(collectionMapper::toSummaryResponse).toList();
    }

    /**
     * Creates an empty collection with a root folder.
     *
     * @param request the name and description
     * @return the created collection's summary
     * @throws ValidationException if the name is blank
     */
    public CollectionSummaryResponse addCollection(@Valid CreateCollectionRequest request) {
        String name = FolderService.requireName(request.name());
        Collection collection = Collection.builder()
                .id(idGenerator.newId())
                .name(name)
                .description(request.description())
                .authentication(AuthConfig.none())
                .build();
        collection.getFolders().put(AppConstants.ROOT_FOLDER_ID, Folder.builder()
                .id(AppConstants.ROOT_FOLDER_ID)
                .name(AppConstants.ROOT_FOLDER_NAME)
                .build());
        Collection added = collectionStore.add(collection);
        log.info("Created collection '{}' ({})", name, added.getId());
        return getCollectionSummary(added.getId());
    }

    /**
     * Gets a full snapshot of a collection, loading it from storage on first access.
     *
     * @param collectionId the collection
     * @return a detached deep copy
     * @throws NotFoundException if the collection does not exist
     */
    public Collection getCollection(String collectionId) {
        return collectionStore.snapshot(collectionId);
    }

    public CollectionSummaryResponse getCollectionSummary(String collectionId) {
        return collectionMapper.toSummaryResponse(collectionStore.indexEntry(collectionId));
    }

    /**
     * Updates name, description or default authentication; null fields are left unchanged.
     *
     * @param collectionId the collection
     * @param request      the fields to change
     * @return the updated summary
     * @throws ValidationException if the name is blank or the authentication is {@code inherit}
     * @throws NotFoundException   if the collection does not exist
     */
    public CollectionSummaryResponse updateCollection(String collectionId, @Valid UpdateCollectionRequest request) {
        String name = request.name() == null ? null : FolderService.requireName(request.name());
        if (request.authentication() != null && request.authentication().getType() == AuthType.INHERIT) {
            throw new ValidationException("A collection has nothing to inherit authentication from");
        }
        collectionStore.update(collectionId, collection -> {
            if (name != null) {
                collection.setName(name);
            }
            if (request.description() != null) {
                collection.setDescription(request.description());
            }
            if (request.authentication() != null) {
                collection.setAuthentication(request.authentication().copy());
            }
        });
        log.info("Updated collection {}", collectionId);
        return getCollectionSummary(collectionId);
    }

    /**
     * Removes a collection and its stored file.
     *
     * @param collectionId the collection
     * @throws ValidationException if it is the scratch collection
     * @throws NotFoundException   if the collection does not exist
     */
    public void removeCollection(String collectionId) {
        collectionStore.remove(collectionId);
        effectiveViewCache.evictCollection(collectionId);
        log.info("Removed collection {}", collectionId);
    }

    /**
     * Reorders collections. Unknown ids are ignored, unlisted collections follow in their
     * current order and the scratch collection always stays first.
     *
     * @param orderedIds the desired order
     * @return the summaries in their new order
     */
    public List<CollectionSummaryResponse> reorderCollections(List<String> orderedIds) {
        collectionStore.reorder(orderedIds);
        log.info("Reordered collections");
        return listCollections();
    }

    /**
     * Deletes every request of the scratch collection.
     *
     * @return the number of requests removed
     */
    public int clearScratchCollection() {
        List<String> removed = collectionStore.mutate(AppConstants.SCRATCH_COLLECTION_ID, collection -> {
            List<String> ids = new ArrayList<>(collection.getRequests().keySet());
            collection.getRequests().clear();
            collection.getFolders().values().forEach(folder -> folder.getRequestIds().clear());
            collection.getRequestIndex().clear();
            return ids;
        });
        removed.forEach(id -> effectiveViewCache.evict(AppConstants.SCRATCH_COLLECTION_ID, id));
        log.info("Cleared {} scratch requests", removed.size());
        return removed.size();
    }

    /**
     * Writes a collection to storage immediately instead of waiting for the next flush.
     *
     * @param collectionId the collection
     * @throws NotFoundException if the collection does not exist
     */
    public void saveCollection(String collectionId) {
        collectionStore.saveNow(collectionId);
        log.info("Saved collection {}", collectionId);
    }

    /**
     * Copies a collection through an export and re-import, so the copy gets fresh ids.
     *
     * @param collectionId the collection to copy
     * @return the copy's summary
     * @throws NotFoundException if the collection does not exist
     */
    public CollectionSummaryResponse duplicateCollection(String collectionId) {
        ExportedCollection document = exportService.exportCollection(collectionId);
        String name = "Copy of " + document.collection().getName();
        String copyId = importService.importAsNewCollection(document, name).collectionId();
        log.info("Duplicated collection {} as {}", collectionId, copyId);
        return getCollectionSummary(copyId);
    }
}
