package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.request.CreateRequestRequest;
import com.codeops.workbench.dto.request.SaveScratchRequestRequest;
import com.codeops.workbench.dto.request.UpdateBodyRequest;
import com.codeops.workbench.dto.request.UpdateFormFieldRequest;
import com.codeops.workbench.dto.request.UpdateParamRequest;
import com.codeops.workbench.dto.request.UpdateRequestPatchRequest;
import com.codeops.workbench.dto.request.UpdateRequestRequest;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.RequestPatch;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Service for requests: structural operations (create, delete, duplicate, move, reorder),
 * direct updates of saved fields, and the draft lifecycle (stage, commit, discard).
 * Reads hand out detached copies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Validated
public class RequestService {

    private final CollectionStore collectionStore;
    private final RequestIndexer requestIndexer;
    private final RequestPatchEngine patchEngine;
    private final EffectiveViewCache effectiveViewCache;
    private final IdGenerator idGenerator;

    /**
     * Creates a request in a folder.
     *
     * @param collectionId the collection
     * @param request      folder (null for root), name, method, url and optional position
     * @return the created request
     * @throws NotFoundException if the collection or folder does not exist
     */
    public Request createRequest(String collectionId, @Valid CreateRequestRequest request) {
        String folderId = request.folderId() == null ? AppConstants.ROOT_FOLDER_ID : request.folderId();
        String name = request.name() == null || request.name().isBlank()
                ? AppConstants.DEFAULT_REQUEST_NAME : request.name().trim();
        Request created = collectionStore.mutate(collectionId, collection -> {
            FolderTree.require(collection, folderId);
            Request entity = Request.builder()
                    .id(idGenerator.newId())
                    .collectionId(collectionId)
                    .name(name)
                    .method(request.method() == null ? HttpMethod.GET : request.method())
                    .url(request.url() == null ? "" : request.url())
                    .build();
            RequestPlacement.insert(collection, requestIndexer, folderId, entity, request.position());
            return entity.copy();
        });
        log.info("Created request '{}' in folder {} of collection {}", name, folderId, collectionId);
        return created;
    }

    /**
     * Deletes a request and renumbers the requests left in its folder.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @throws NotFoundException if the collection or request does not exist
     */
    public void deleteRequest(String collectionId, String requestId) {
        collectionStore.update(collectionId, collection -> {
            RequestPlacement.detach(collection, requestIndexer, requestId);
            collection.getRequests().remove(requestId);
        });
        effectiveViewCache.evict(collectionId, requestId);
        log.info("Deleted request {} from collection {}", requestId, collectionId);
    }

    /**
     * Copies a request, draft included, and appends the copy to the same folder.
     *
     * @param collectionId the collection
     * @param requestId    the request to copy
     * @return the copy
     * @throws NotFoundException if the collection or request does not exist
     */
    public Request duplicateRequest(String collectionId, String requestId) {
        Request duplicate = collectionStore.mutate(collectionId, collection -> {
            Request source = RequestPlacement.require(collection, requestId);
            Request copy = source.copy();
            copy.setId(idGenerator.newId());
            copy.setName("Copy of " + source.getName());
            copy.setUpdated(0);
            RequestPlacement.insert(collection, requestIndexer, source.getFolderId(), copy, null);
            return copy.copy();
        });
        log.info("Duplicated request {} as {} in collection {}", requestId, duplicate.getId(), collectionId);
        return duplicate;
    }

    /**
     * Updates saved fields directly, leaving the draft alone. A different {@code folderId}
     * appends the request to that folder.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @param update       the fields to change
     * @return the updated request
     * @throws NotFoundException if the collection, request or target folder does not exist
     */
    public Request updateRequest(String collectionId, String requestId, @Valid UpdateRequestRequest update) {
        Request updated = collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            boolean move = update.folderId() != null && !update.folderId().equals(request.getFolderId());
            if (move) {
                FolderTree.require(collection, update.folderId());
                RequestPlacement.detach(collection, requestIndexer, requestId);
                RequestPlacement.insert(collection, requestIndexer, update.folderId(), request, null);
            }
            if (update.name() != null) {
                request.setName(update.name());
            }
            if (update.method() != null) {
                request.setMethod(update.method());
            }
            if (update.url() != null) {
                request.setUrl(update.url());
            }
            if (update.autoSave() != null) {
                request.setAutoSave(update.autoSave());
            }
            if (update.environmentId() != null) {
                request.setEnvironmentId(update.environmentId());
            }
            if (update.authentication() != null) {
                request.setAuthentication(update.authentication().copy());
            }
            if (update.tests() != null) {
                request.setTests(update.tests());
            }
            request.setUpdated(request.getUpdated() + 1);
            return request.copy();
        });
        log.info("Updated request {} in collection {}", requestId, collectionId);
        return updated;
    }

    /**
     * Moves a request into a folder at a position and renumbers the target folder.
     *
     * @param collectionId   the collection
     * @param requestId      the request
     * @param targetFolderId the target folder
     * @param position       zero-based position, null to append
     * @return the moved request
     * @throws NotFoundException if the collection, request or folder does not exist
     */
    public Request moveRequestToFolder(String collectionId, String requestId, String targetFolderId, Integer position) {
        Request moved = collectionStore.mutate(collectionId, collection -> {
            RequestPlacement.require(collection, requestId);
            FolderTree.require(collection, targetFolderId);
            Request request = RequestPlacement.detach(collection, requestIndexer, requestId);
            RequestPlacement.insert(collection, requestIndexer, targetFolderId, request, position);
            return request.copy();
        });
        log.info("Moved request {} to folder {} in collection {}", requestId, targetFolderId, collectionId);
        return moved;
    }

    /**
     * Reorders the requests of a folder. Unknown ids are ignored and unlisted requests
     * follow the listed ones in their current order.
     *
     * @param collectionId the collection
     * @param folderId     the folder
     * @param orderedIds   the desired order
     * @return the request ids in their new order
     * @throws NotFoundException if the collection or folder does not exist
     */
    public List<String> reorderRequestsInFolder(String collectionId, String folderId, List<String> orderedIds) {
        List<String> result = collectionStore.mutate(collectionId, collection -> {
            Folder folder = FolderTree.require(collection, folderId);
            folder.setRequestIds(FolderService.mergeOrder(folder.getRequestIds(), orderedIds));
            for (int i = 0; i < folder.getRequestIds().size(); i++) {
                Request request = collection.getRequests().get(folder.getRequestIds().get(i));
                request.setOrder(i + 1);
                request.setFolderId(folderId);
                requestIndexer.updateEntry(collection, request.getId());
            }
            return List.copyOf(folder.getRequestIds());
        });
        log.info("Reordered {} requests in folder {} of collection {}", result.size(), folderId, collectionId);
        return result;
    }

    /**
     * Gets a request as stored: saved fields plus its draft.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @return a detached copy
     * @throws NotFoundException if the collection or request does not exist
     */
    public Request getRequest(String collectionId, String requestId) {
        return collectionStore.read(collectionId, collection -> RequestPlacement.require(collection, requestId).copy());
    }

    /**
     * Gets the request with its draft applied, as the execution pipeline should see it.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @return a detached effective view with an empty draft
     * @throws NotFoundException if the collection or request does not exist
     */
    public Request getEffectiveRequest(String collectionId, String requestId) {
        return collectionStore.read(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            return effectiveViewCache.get(collectionId, request, () -> patchEngine.effectiveView(request));
        });
    }

    /**
     * Stages draft edits.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @param update       the edits
     * @return the resulting draft
     * @throws ValidationException if the update is empty
     * @throws NotFoundException   if the collection or request does not exist
     */
    public RequestPatch updateRequestPatch(String collectionId, String requestId, UpdateRequestPatchRequest update) {
        return collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            patchEngine.applyPatch(request, update);
            return request.getPatch().copy();
        });
    }

    /**
     * Stages an upsert, or with a null update a deletion, of one parameter entry.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @param kind         which parameter map
     * @param paramId      the entry id
     * @param update       the entry fields to change, or null to delete
     * @return the resulting draft
     */
    public RequestPatch updateRequestParam(String collectionId, String requestId, ParamKind kind,
                                           String paramId, UpdateParamRequest update) {
        return collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            patchEngine.updateParam(request, kind, paramId, update);
            return request.getPatch().copy();
        });
    }

    public RequestPatch updateRequestFormField(String collectionId, String requestId, String fieldId,
                                               UpdateFormFieldRequest update) {
        return collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            patchEngine.updateFormField(request, fieldId, update);
            return request.getPatch().copy();
        });
    }

    public RequestPatch updateRequestBody(String collectionId, String requestId, UpdateBodyRequest update) {
        return collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            patchEngine.updateBody(request, update);
            return request.getPatch().copy();
        });
    }

    /**
     * Commits the draft into the saved fields. An empty draft commits nothing.
     *
     * @param collectionId the collection
     * @param requestId    the request
     * @return the request after the commit
     * @throws NotFoundException if the collection or request does not exist
     */
    public Request commitRequestPatch(String collectionId, String requestId) {
        Request committed = collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            if (patchEngine.commit(request)) {
                log.info("Committed draft of request {} in collection {}", requestId, collectionId);
            }
            return request.copy();
        });
        return committed;
    }

    public Request discardRequestPatch(String collectionId, String requestId) {
        Request discarded = collectionStore.mutate(collectionId, collection -> {
            Request request = RequestPlacement.require(collection, requestId);
            patchEngine.discard(request);
            return request.copy();
        });
        log.info("Discarded draft of request {} in collection {}", requestId, collectionId);
        return discarded;
    }

    public boolean isRequestDirty(String collectionId, String requestId) {
        return collectionStore.read(collectionId,
                collection -> patchEngine.isDirty(RequestPlacement.require(collection, requestId)));
    }

    /**
     * Moves a scratch request into a regular collection, committing its draft on the way.
     *
     * @param requestId the scratch request
     * @param request   target collection, folder (null for root) and optional new name
     * @return the request in its new collection
     * @throws ValidationException if the target is the scratch collection
     * @throws NotFoundException   if the request, target collection or folder does not exist
     */
    public Request saveScratchRequest(String requestId, @Valid SaveScratchRequestRequest request) {
        if (AppConstants.SCRATCH_COLLECTION_ID.equals(request.collectionId())) {
            throw new ValidationException("A scratch request must be saved into a regular collection");
        }
        String folderId = request.folderId() == null ? AppConstants.ROOT_FOLDER_ID : request.folderId();
        Request saved = collectionStore.mutateBoth(AppConstants.SCRATCH_COLLECTION_ID, request.collectionId(),
                (scratch, target) -> {
                    RequestPlacement.require(scratch, requestId);
                    FolderTree.require(target, folderId);
                    Request moving = RequestPlacement.detach(scratch, requestIndexer, requestId);
                    scratch.getRequests().remove(requestId);
                    patchEngine.commit(moving);
                    if (request.name() != null && !request.name().isBlank()) {
                        moving.setName(request.name().trim());
                    }
                    if (target.getRequests().containsKey(moving.getId())) {
                        moving.setId(idGenerator.newId());
                    }
                    RequestPlacement.insert(target, requestIndexer, folderId, moving, null);
                    return moving.copy();
                });
        effectiveViewCache.evict(AppConstants.SCRATCH_COLLECTION_ID, requestId);
        log.info("Saved scratch request {} into collection {}", requestId, request.collectionId());
        return saved;
    }
}
