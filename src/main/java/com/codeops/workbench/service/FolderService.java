package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.mapper.FolderMapper;
import com.codeops.workbench.dto.mapper.RequestMapper;
import com.codeops.workbench.dto.request.CreateFolderRequest;
import com.codeops.workbench.dto.response.FolderResponse;
import com.codeops.workbench.dto.response.FolderTreeResponse;
import com.codeops.workbench.dto.response.RequestSummaryResponse;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for the folder tree of a collection: create, rename, delete, move and reorder,
 * each leaving sibling order dense and the request index consistent when it returns.
 * Every operation validates before it changes anything.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Validated
public class FolderService {

    private final CollectionStore collectionStore;
    private final RequestIndexer requestIndexer;
    private final RequestPatchEngine patchEngine;
    private final EffectiveViewCache effectiveViewCache;
    private final IdGenerator idGenerator;
    private final FolderMapper folderMapper;
    private final RequestMapper requestMapper;

    /**
     * Creates a folder as the last child of its parent.
     *
     * @param collectionId the collection
     * @param request      the parent (null for root) and the folder name
     * @return the created folder
     * @throws NotFoundException   if the collection or parent folder does not exist
     * @throws ValidationException if the name is blank or the collection is the scratch collection
     */
    public FolderResponse createFolder(String collectionId, @Valid CreateFolderRequest request) {
        rejectScratch(collectionId);
        String name = requireName(request.name());
        String parentId = request.parentId() == null ? AppConstants.ROOT_FOLDER_ID : request.parentId();

        FolderResponse response = collectionStore.mutate(collectionId, collection -> {
            FolderTree.require(collection, parentId);
            Folder folder = Folder.builder()
                    .id(idGenerator.newId())
                    .name(name)
                    .parentId(parentId)
                    .build();
            collection.getFolders().put(folder.getId(), folder);
            FolderTree.insertChild(collection, parentId, folder.getId(), null);
            return folderMapper.toResponse(folder, collectionId);
        });
        log.info("Created folder '{}' in collection {}", name, collectionId);
        return response;
    }

    /**
     * Renames a folder.
     *
     * @param collectionId the collection
     * @param folderId     the folder
     * @param name         the new name, trimmed
     * @return the renamed folder
     * @throws ValidationException if the folder is root or the name is blank
     * @throws NotFoundException   if the folder does not exist
     */
    public FolderResponse renameFolder(String collectionId, String folderId, String name) {
        rejectScratch(collectionId);
        rejectRoot(folderId, "renamed");
        String trimmed = requireName(name);
        FolderResponse response = collectionStore.mutate(collectionId, collection -> {
            Folder folder = FolderTree.require(collection, folderId);
            folder.setName(trimmed);
            return folderMapper.toResponse(folder, collectionId);
        });
        log.info("Renamed folder {} to '{}'", folderId, trimmed);
        return response;
    }

    /**
     * Deletes a folder with every folder and request beneath it.
     *
     * @param collectionId the collection
     * @param folderId     the folder
     * @throws ValidationException if the folder is root
     * @throws NotFoundException   if the folder does not exist
     */
    public void deleteFolder(String collectionId, String folderId) {
        rejectScratch(collectionId);
        rejectRoot(folderId, "deleted");
        List<String> deletedRequests = collectionStore.mutate(collectionId, collection -> {
            Folder folder = FolderTree.require(collection, folderId);
            Set<String> subtree = FolderTree.collectSubtree(collection, folderId);
            List<String> requestIds = new ArrayList<>();
            for (String id : subtree) {
                Folder node = collection.getFolders().get(id);
                if (node != null) {
                    requestIds.addAll(node.getRequestIds());
                }
            }
            FolderTree.removeChild(collection, folder.getParentId(), folderId);
            for (String requestId : requestIds) {
                collection.getRequests().remove(requestId);
                requestIndexer.removeEntry(collection, requestId);
            }
            subtree.forEach(collection.getFolders()::remove);
            return requestIds;
        });
        deletedRequests.forEach(id -> effectiveViewCache.evict(collectionId, id));
        log.info("Deleted folder {} with {} requests from collection {}", folderId, deletedRequests.size(), collectionId);
    }

    /**
     * Moves a folder under a new parent.
     *
     * @param collectionId the collection
     * @param folderId     the folder to move
     * @param newParentId  the new parent, null for root
     * @param position     zero-based position among the new siblings, null to append
     * @return the moved folder
     * @throws ValidationException if the folder is root, or the target is the folder itself or one of its descendants
     * @throws NotFoundException   if either folder does not exist
     */
    public FolderResponse moveFolder(String collectionId, String folderId, String newParentId, Integer position) {
        rejectScratch(collectionId);
        rejectRoot(folderId, "moved");
        String parentId = newParentId == null ? AppConstants.ROOT_FOLDER_ID : newParentId;
        if (folderId.equals(parentId)) {
            throw new ValidationException("A folder cannot be moved into itself");
        }
        FolderResponse response = collectionStore.mutate(collectionId, collection -> {
            Folder folder = FolderTree.require(collection, folderId);
            FolderTree.require(collection, parentId);
            if (FolderTree.wouldCreateCycle(collection, folderId, parentId)) {
                throw new ValidationException("Cannot move folder " + folderId
                        + " under its own descendant " + parentId);
            }
            FolderTree.removeChild(collection, folder.getParentId(), folderId);
            FolderTree.insertChild(collection, parentId, folderId, position);
            requestIndexer.updateSubtree(collection, folderId);
            return folderMapper.toResponse(folder, collectionId);
        });
        log.info("Moved folder {} to parent {} in collection {}", folderId, parentId, collectionId);
        return response;
    }

    /**
     * Reorders the children of a folder. Listed ids that are not current children are
     * ignored and children left out keep their relative order after the listed ones.
     *
     * @param collectionId the collection
     * @param parentId     the parent folder
     * @param orderedIds   the desired child order
     * @return the children in their new order
     * @throws NotFoundException if the parent folder does not exist
     */
    public List<FolderResponse> reorderFolders(String collectionId, String parentId, List<String> orderedIds) {
        rejectScratch(collectionId);
        List<FolderResponse> response = collectionStore.mutate(collectionId, collection -> {
            Folder parent = FolderTree.require(collection, parentId);
            parent.setChildFolderIds(mergeOrder(parent.getChildFolderIds(), orderedIds));
            FolderTree.resequenceSiblings(collection, parentId);
            return parent.getChildFolderIds().stream()
                    .map(id -> folderMapper.toResponse(collection.getFolders().get(id), collectionId))
                    .toList();
        });
        log.info("Reordered {} folders under {} in collection {}", response.size(), parentId, collectionId);
        return response;
    }

    /**
     * Gets a single folder.
     *
     * @param collectionId the collection
     * @param folderId     the folder
     * @return the folder
     * @throws NotFoundException if the collection or folder does not exist
     */
    public FolderResponse getFolder(String collectionId, String folderId) {
        return collectionStore.read(collectionId,
                collection -> folderMapper.toResponse(FolderTree.require(collection, folderId), collectionId));
    }

    /**
     * Builds the whole tree of a collection from root, requests shown with their drafts applied.
     *
     * @param collectionId the collection
     * @return the root node
     * @throws NotFoundException if the collection does not exist
     */
    public FolderTreeResponse getFolderTree(String collectionId) {
        return collectionStore.read(collectionId,
                collection -> buildTreeNode(collection, FolderTree.require(collection, AppConstants.ROOT_FOLDER_ID)));
    }

    private FolderTreeResponse buildTreeNode(Collection collection, Folder folder) {
        List<FolderTreeResponse> children = folder.getChildFolderIds().stream()
                .map(id -> buildTreeNode(collection, collection.getFolders().get(id)))
                .toList();
        List<RequestSummaryResponse> requests = folder.getRequestIds().stream()
                .map(id -> collection.getRequests().get(id))
                .map(this::toSummary)
                .toList();
        return new FolderTreeResponse(folder.getId(), folder.getName(), folder.getOrder(), children, requests);
    }

    private RequestSummaryResponse toSummary(Request request) {
        return requestMapper.toSummaryResponse(patchEngine.effectiveView(request), patchEngine.isDirty(request));
    }

    /**
     * Listed ids that are present in {@code current} first, then the rest of {@code current}.
     */
    static List<String> mergeOrder(List<String> current, List<String> orderedIds) {
        Set<String> merged = new LinkedHashSet<>();
        for (String id : orderedIds) {
            if (current.contains(id)) {
                merged.add(id);
            }
        }
        merged.addAll(current);
        return new ArrayList<>(merged);
    }

    static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name must not be blank");
        }
        return name.trim();
    }

    private static void rejectRoot(String folderId, String action) {
        if (AppConstants.ROOT_FOLDER_ID.equals(folderId)) {
            throw new ValidationException("The root folder cannot be " + action);
        }
    }

    private static void rejectScratch(String collectionId) {
        if (AppConstants.SCRATCH_COLLECTION_ID.equals(collectionId)) {
            throw new ValidationException("The scratch collection does not support folders");
        }
    }
}
