package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.document.ExportedCollection;
import com.codeops.workbench.dto.response.MergeResultResponse;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Environment;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Merges a native export document into an existing collection. Requests are matched by id
 * first and by method and URL second; matches are overwritten in place, everything else is
 * added along with any folders it needs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeService {

    private final CollectionStore collectionStore;
    private final RequestIndexer requestIndexer;
    private final EffectiveViewCache effectiveViewCache;
    private final IdGenerator idGenerator;

    /**
     * Merges {@code document} into a collection.
     *
     * <p>Environments with a known id are overwritten field by field, unknown ones are added.
     * A matched request takes every saved field from the document but keeps its own folder,
     * order and draft. An unmatched request lands in the folder it had in the document, which
     * is created together with its missing ancestors.</p>
     *
     * @param collectionId the target collection
     * @param document     the export document
     * @return counts of what was added and updated
     * @throws ValidationException if the document is not a native export
     * @throws NotFoundException   if the collection does not exist
     */
    public MergeResultResponse mergeIntoExisting(String collectionId, ExportedCollection document) {
        ImportService.validate(document);
        Collection incoming = document.collection().copy();

        MergeResultResponse result = collectionStore.mutate(collectionId, collection -> {
            int addedEnvironments = 0;
            int updatedEnvironments = 0;
            for (Map.Entry<String, Environment> entry : incoming.getEnvironments().entrySet()) {
                Environment environment = entry.getValue();
                if (environment == null) {
                    continue;
                }
                if (environment.getId() == null) {
                    environment.setId(entry.getKey());
                }
                Environment existing = collection.getEnvironments().get(environment.getId());
                if (existing != null) {
                    mergeEnvironment(existing, environment);
                    updatedEnvironments++;
                } else {
                    collection.getEnvironments().put(environment.getId(), environment.copy());
                    addedEnvironments++;
                }
            }

            Map<String, String> signatures = new HashMap<>();
            collection.getRequests().values().forEach(r ->
                    signatures.put(ImportService.buildSignature(r.getMethod(), r.getUrl()), r.getId()));

            int addedRequests = 0;
            int updatedRequests = 0;
            for (Map.Entry<String, Request> entry : incoming.getRequests().entrySet()) {
                Request source = entry.getValue();
                if (source == null) {
                    continue;
                }
                if (source.getId() == null) {
                    source.setId(entry.getKey());
                }
                String signature = ImportService.buildSignature(source.getMethod(), source.getUrl());
                String targetId = source.getId() != null && collection.getRequests().containsKey(source.getId())
                        ? source.getId()
                        : signatures.get(signature);

                if (targetId != null) {
                    Request existing = collection.getRequests().get(targetId);
                    signatures.remove(ImportService.buildSignature(existing.getMethod(), existing.getUrl()));
                    Request merged = overwrite(existing, source, collection);
                    collection.getRequests().put(targetId, merged);
                    requestIndexer.updateEntry(collection, targetId);
                    signatures.put(signature, targetId);
                    effectiveViewCache.evict(collectionId, targetId);
                    updatedRequests++;
                } else {
                    String folderId = ensureFolderExists(collection, incoming, source.getFolderId(), new HashSet<>());
                    Request added = source.copy();
                    if (added.getId() == null) {
                        added.setId(idGenerator.newId());
                    }
                    CollectionNormalizer.applyRequestDefaults(added);
                    RequestPlacement.insert(collection, requestIndexer, folderId, added, null);
                    signatures.put(signature, added.getId());
                    addedRequests++;
                }
            }
            return new MergeResultResponse(addedRequests, updatedRequests, addedEnvironments, updatedEnvironments);
        });
        log.info("Merged into collection {}: {} requests added, {} updated, {} environments added, {} updated",
                collectionId, result.addedRequests(), result.updatedRequests(),
                result.addedEnvironments(), result.updatedEnvironments());
        return result;
    }

    private static Request overwrite(Request existing, Request source, Collection collection) {
        Request merged = source.copy();
        CollectionNormalizer.applyRequestDefaults(merged);
        merged.setId(existing.getId());
        merged.setCollectionId(collection.getId());
        merged.setFolderId(collection.getFolders().containsKey(existing.getFolderId())
                ? existing.getFolderId()
                : AppConstants.ROOT_FOLDER_ID);
        merged.setOrder(existing.getOrder());
        merged.setPatch(existing.getPatch());
        merged.setUpdated(existing.getUpdated() + 1);
        return merged;
    }

    private static void mergeEnvironment(Environment existing, Environment incoming) {
        if (incoming.getName() != null) {
            existing.setName(incoming.getName());
        }
        if (incoming.getDescription() != null) {
            existing.setDescription(incoming.getDescription());
        }
        if (incoming.getVariables() != null) {
            existing.setVariables(new LinkedHashMap<>(incoming.copy().getVariables()));
        }
    }

    /**
     * Returns the id of a folder that exists in {@code collection} for the document folder
     * {@code folderId}, creating it and its ancestors as needed. A folder met twice on the way
     * up means the document's folders form a cycle, and the chain is cut at root.
     */
    private String ensureFolderExists(Collection collection, Collection incoming, String folderId, Set<String> visiting) {
        if (folderId == null || AppConstants.ROOT_FOLDER_ID.equals(folderId)) {
            return AppConstants.ROOT_FOLDER_ID;
        }
        if (collection.getFolders().containsKey(folderId)) {
            return folderId;
        }
        Folder exported = incoming.getFolders().get(folderId);
        if (!visiting.add(folderId)) {
            log.warn("Folder {} in merged document is part of a parent cycle, attaching to root", folderId);
            return AppConstants.ROOT_FOLDER_ID;
        }
        String parentId = ensureFolderExists(collection, incoming,
                exported == null ? null : exported.getParentId(), visiting);
        if (collection.getFolders().containsKey(folderId)) {
            return folderId;
        }
        String name = exported == null || exported.getName() == null || exported.getName().isBlank()
                ? AppConstants.IMPORTED_FOLDER_NAME
                : exported.getName();
        Folder folder = Folder.builder()
                .id(folderId)
                .name(name)
                .parentId(parentId)
                .build();
        collection.getFolders().put(folderId, folder);
        Integer position = exported == null ? null : exported.getOrder() - 1;
        FolderTree.insertChild(collection, parentId, folderId, position);
        return folderId;
    }
}
