package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.ClientOptions;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.RequestBody;
import com.codeops.workbench.entity.RequestPatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs a collection of unknown provenance in place so that every tree and index
 * invariant holds afterwards. Running it on an already normalized collection changes nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollectionNormalizer {

    private static final Comparator<Folder> FOLDER_ORDER = Comparator
            .comparingInt(Folder::getOrder)
            .thenComparing(f -> f.getName() == null ? "" : f.getName());

    private static final Comparator<Request> REQUEST_ORDER = Comparator
            .comparing((Request r) -> r.getOrder() == null ? Integer.MAX_VALUE : r.getOrder())
            .thenComparing(Request::getId);

    private final RequestIndexer requestIndexer;

    /**
     * Normalizes {@code collection} in place.
     *
     * @param collection a freshly loaded or imported collection
     * @return the same instance, for chaining
     */
    public Collection normalize(Collection collection) {
        applyDefaults(collection);
        ensureRoot(collection);
        reattachOrphans(collection);
        rebuildChildren(collection);
        repairRequests(collection);
        rebuildRequestIds(collection);
        requestIndexer.rebuildIndex(collection);
        return collection;
    }

    private void applyDefaults(Collection collection) {
        if (collection.getFolders() == null) {
            collection.setFolders(new LinkedHashMap<>());
        }
        if (collection.getRequests() == null) {
            collection.setRequests(new LinkedHashMap<>());
        }
        if (collection.getEnvironments() == null) {
            collection.setEnvironments(new LinkedHashMap<>());
        }
        if (collection.getAuthentication() == null || collection.getAuthentication().getType() == null) {
            collection.setAuthentication(AuthConfig.none());
        }
        if (collection.getActiveEnvironmentId() != null
                && !collection.getEnvironments().containsKey(collection.getActiveEnvironmentId())) {
            collection.setActiveEnvironmentId(null);
        }
        collection.getEnvironments().entrySet().removeIf(e -> e.getValue() == null);
        collection.getEnvironments().forEach((key, environment) -> {
            environment.setId(key);
            if (environment.getVariables() == null) {
                environment.setVariables(new LinkedHashMap<>());
            }
        });
        collection.getFolders().entrySet().removeIf(e -> e.getValue() == null);
        collection.getFolders().forEach((key, folder) -> {
            folder.setId(key);
            if (folder.getChildFolderIds() == null) {
                folder.setChildFolderIds(new ArrayList<>());
            }
            if (folder.getRequestIds() == null) {
                folder.setRequestIds(new ArrayList<>());
            }
        });
    }

    private void ensureRoot(Collection collection) {
        Folder root = collection.getFolders().get(AppConstants.ROOT_FOLDER_ID);
        if (root == null) {
            log.warn("Collection {} has no root folder, creating one", collection.getId());
            root = Folder.builder()
                    .id(AppConstants.ROOT_FOLDER_ID)
                    .name(AppConstants.ROOT_FOLDER_NAME)
                    .build();
            collection.getFolders().put(AppConstants.ROOT_FOLDER_ID, root);
        }
        root.setParentId(null);
        root.setOrder(1);
        if (isBlank(root.getName())) {
            root.setName(AppConstants.ROOT_FOLDER_NAME);
        }
    }

    private void reattachOrphans(Collection collection) {
        Map<String, Folder> folders = collection.getFolders();
        for (Folder folder : folders.values()) {
            if (AppConstants.ROOT_FOLDER_ID.equals(folder.getId())) {
                continue;
            }
            String parentId = folder.getParentId();
            if (parentId == null || parentId.equals(folder.getId()) || !folders.containsKey(parentId)) {
                if (parentId != null) {
                    log.warn("Folder {} in collection {} references missing parent {}, moving to root",
                            folder.getId(), collection.getId(), parentId);
                }
                folder.setParentId(AppConstants.ROOT_FOLDER_ID);
            }
            if (isBlank(folder.getName())) {
                folder.setName(AppConstants.DEFAULT_FOLDER_NAME);
            }
        }
        // breaking one link of a cycle makes the rest of it reach root
        for (Folder folder : folders.values()) {
            if (FolderTree.ancestryOrNull(folders, folder.getId()) == null) {
                log.warn("Folder {} in collection {} is part of a parent cycle, moving to root",
                        folder.getId(), collection.getId());
                folder.setParentId(AppConstants.ROOT_FOLDER_ID);
            }
        }
    }

    private void rebuildChildren(Collection collection) {
        Map<String, List<Folder>> byParent = new LinkedHashMap<>();
        for (Folder folder : collection.getFolders().values()) {
            if (folder.getParentId() != null) {
                byParent.computeIfAbsent(folder.getParentId(), k -> new ArrayList<>()).add(folder);
            }
        }
        for (Folder parent : collection.getFolders().values()) {
            List<Folder> children = byParent.getOrDefault(parent.getId(), new ArrayList<>());
            children.sort(FOLDER_ORDER);
            List<String> childIds = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                children.get(i).setOrder(i + 1);
                childIds.add(children.get(i).getId());
            }
            parent.setChildFolderIds(childIds);
        }
    }

    private void repairRequests(Collection collection) {
        collection.getRequests().entrySet().removeIf(e -> e.getValue() == null);
        int nextOrder = collection.getRequests().values().stream()
                .filter(r -> r.getOrder() != null)
                .mapToInt(Request::getOrder)
                .max()
                .orElse(0) + 1;
        for (Map.Entry<String, Request> entry : collection.getRequests().entrySet()) {
            Request request = entry.getValue();
            request.setId(entry.getKey());
            request.setCollectionId(collection.getId());
            if (request.getFolderId() == null || !collection.getFolders().containsKey(request.getFolderId())) {
                if (request.getFolderId() != null) {
                    log.warn("Request {} in collection {} references missing folder {}, moving to root",
                            request.getId(), collection.getId(), request.getFolderId());
                }
                request.setFolderId(AppConstants.ROOT_FOLDER_ID);
            }
            if (request.getOrder() == null) {
                request.setOrder(nextOrder++);
            }
            applyRequestDefaults(request);
        }
    }

    private void rebuildRequestIds(Collection collection) {
        Map<String, List<Request>> byFolder = new LinkedHashMap<>();
        for (Request request : collection.getRequests().values()) {
            byFolder.computeIfAbsent(request.getFolderId(), k -> new ArrayList<>()).add(request);
        }
        for (Folder folder : collection.getFolders().values()) {
            List<Request> owned = byFolder.getOrDefault(folder.getId(), new ArrayList<>());
            owned.sort(REQUEST_ORDER);
            folder.setRequestIds(new ArrayList<>(owned.stream().map(Request::getId).toList()));
        }
    }

    /**
     * Fills in empty parameter maps, body, authentication, options and draft.
     */
    static void applyRequestDefaults(Request request) {
        if (request.getPathParams() == null) {
            request.setPathParams(new LinkedHashMap<>());
        }
        if (request.getQueryParams() == null) {
            request.setQueryParams(new LinkedHashMap<>());
        }
        if (request.getHeaders() == null) {
            request.setHeaders(new LinkedHashMap<>());
        }
        if (request.getCookieParams() == null) {
            request.setCookieParams(new LinkedHashMap<>());
        }
        if (request.getBody() == null) {
            request.setBody(RequestBody.none());
        }
        if (request.getAuthentication() == null || request.getAuthentication().getType() == null) {
            request.setAuthentication(AuthConfig.inherit());
        }
        if (request.getOptions() == null) {
            request.setOptions(new ClientOptions());
        }
        if (request.getPatch() == null) {
            request.setPatch(new RequestPatch());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
