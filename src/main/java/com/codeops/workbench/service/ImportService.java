package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.document.ExportedCollection;
import com.codeops.workbench.dto.response.ImportResultResponse;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Environment;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.enums.AuthType;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports native export documents as brand new collections. Every folder and request
 * gets a fresh id, so importing the same document twice yields two independent collections.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportService {

    private final CollectionStore collectionStore;
    private final IdGenerator idGenerator;
    private final ObjectMapper objectMapper;

    /**
     * Identity of a request across collections: method name and trimmed URL.
     *
     * @param method the HTTP method, may be null
     * @param url    the URL, may be null
     * @return the signature, e.g. {@code GET::https://example.com}
     */
    public static String buildSignature(HttpMethod method, String url) {
        String m = method == null ? "" : method.name();
        String u = url == null ? "" : url.trim();
        return m + AppConstants.SIGNATURE_SEPARATOR + u;
    }

    /**
     * Parses and validates a native export document.
     *
     * @param json the document text
     * @return the parsed document
     * @throws ValidationException if the text is not JSON, the format is not native or the collection is missing
     */
    public ExportedCollection parseDocument(String json) {
        ExportedCollection document;
        try {
            document = objectMapper.readValue(json, ExportedCollection.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Import content is not a valid export document: " + e.getOriginalMessage());
        }
        validate(document);
        return document;
    }

    /**
     * Creates a new collection from a document.
     *
     * @param document     the export document
     * @param overrideName name for the new collection, or null to keep the document's
     * @return what was imported
     * @throws ValidationException if the document is not a native export
     */
    public ImportResultResponse importAsNewCollection(ExportedCollection document, String overrideName) {
        validate(document);
        Collection source = document.collection().copy();
        String collectionId = idGenerator.newId();

        Map<String, String> folderIds = new HashMap<>();
        folderIds.put(AppConstants.ROOT_FOLDER_ID, AppConstants.ROOT_FOLDER_ID);
        source.getFolders().keySet().forEach(id -> folderIds.computeIfAbsent(id, k -> idGenerator.newId()));
        Map<String, String> requestIds = new HashMap<>();
        source.getRequests().keySet().forEach(id -> requestIds.put(id, idGenerator.newId()));

        Map<String, Folder> folders = new LinkedHashMap<>();
        source.getFolders().forEach((oldId, folder) -> {
            if (folder == null) {
                return;
            }
            Folder copy = folder.copy();
            copy.setId(folderIds.get(oldId));
            copy.setParentId(folder.getParentId() == null ? null
                    : folderIds.getOrDefault(folder.getParentId(), folder.getParentId()));
            copy.setChildFolderIds(remap(folder.getChildFolderIds(), folderIds));
            copy.setRequestIds(remap(folder.getRequestIds(), requestIds));
            folders.put(copy.getId(), copy);
        });
        if (!folders.containsKey(AppConstants.ROOT_FOLDER_ID)) {
            folders.put(AppConstants.ROOT_FOLDER_ID, Folder.builder()
                    .id(AppConstants.ROOT_FOLDER_ID)
                    .name(AppConstants.ROOT_FOLDER_NAME)
                    .build());
        }

        Map<String, Request> requests = new LinkedHashMap<>();
        source.getRequests().forEach((oldId, request) -> {
            if (request == null) {
                return;
            }
            Request copy = request.copy();
            copy.setId(requestIds.get(oldId));
            copy.setCollectionId(collectionId);
            String folderId = request.getFolderId() == null ? null : folderIds.get(request.getFolderId());
            copy.setFolderId(folderId != null && folders.containsKey(folderId) ? folderId : AppConstants.ROOT_FOLDER_ID);
            requests.put(copy.getId(), copy);
        });
        renumberRequests(folders, requests);

        Map<String, Environment> environments = new LinkedHashMap<>();
        source.getEnvironments().forEach((id, env) -> {
            if (env != null) {
                environments.put(id, env.copy());
            }
        });

        AuthConfig authentication = source.getAuthentication();
        if (authentication == null || authentication.getType() == null || authentication.getType() == AuthType.INHERIT) {
            authentication = AuthConfig.none();
        }

        String name = firstNonBlank(overrideName, source.getName(), AppConstants.DEFAULT_COLLECTION_NAME);
        Collection collection = Collection.builder()
                .id(collectionId)
                .name(name)
                .description(source.getDescription())
                .authentication(authentication)
                .activeEnvironmentId(source.getActiveEnvironmentId())
                .environments(environments)
                .folders(folders)
                .requests(requests)
                .build();
        Collection added = collectionStore.add(collection);

        log.info("Imported collection '{}' ({}) with {} folders and {} requests",
                name, collectionId, added.getFolders().size() - 1, added.getRequests().size());
        return new ImportResultResponse(collectionId, name,
                added.getFolders().size() - 1,
                added.getRequests().size(),
                added.getEnvironments().size());
    }

    static void validate(ExportedCollection document) {
        if (document == null || !AppConstants.EXPORT_FORMAT.equals(document.format())) {
            throw new ValidationException("Unsupported import format: "
                    + (document == null ? null : document.format()));
        }
        if (document.collection() == null) {
            throw new ValidationException("Export document has no collection");
        }
    }

    /**
     * Orders each folder's requests as the document listed them, then appends requests the
     * folder did not list, and numbers them 1..N.
     */
    private static void renumberRequests(Map<String, Folder> folders, Map<String, Request> requests) {
        Map<String, List<String>> byFolder = new HashMap<>();
        requests.values().forEach(r -> byFolder.computeIfAbsent(r.getFolderId(), k -> new ArrayList<>()).add(r.getId()));
        for (Folder folder : folders.values()) {
            List<String> owned = byFolder.getOrDefault(folder.getId(), List.of());
            List<String> ordered = new ArrayList<>();
            for (String id : folder.getRequestIds()) {
                if (owned.contains(id) && !ordered.contains(id)) {
                    ordered.add(id);
                }
            }
            for (String id : owned) {
                if (!ordered.contains(id)) {
                    ordered.add(id);
                }
            }
            for (int i = 0; i < ordered.size(); i++) {
                requests.get(ordered.get(i)).setOrder(i + 1);
            }
            folder.setRequestIds(ordered);
        }
    }

    private static List<String> remap(List<String> ids, Map<String, String> mapping) {
        List<String> result = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                String mapped = mapping.get(id);
                if (mapped != null) {
                    result.add(mapped);
                }
            }
        }
        return result;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
