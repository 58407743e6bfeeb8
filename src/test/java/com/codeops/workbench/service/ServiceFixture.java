package com.codeops.workbench.service;

import com.codeops.workbench.config.WorkbenchProperties;
import com.codeops.workbench.dto.mapper.CollectionMapper;
import com.codeops.workbench.dto.mapper.EnvironmentMapper;
import com.codeops.workbench.dto.mapper.FolderMapper;
import com.codeops.workbench.dto.mapper.RequestMapper;
import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.request.CreateFolderRequest;
import com.codeops.workbench.dto.request.CreateRequestRequest;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.storage.CollectionSanitizer;
import com.codeops.workbench.storage.CollectionStorage;
import com.codeops.workbench.store.CollectionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapstruct.factory.Mappers;

import static org.mockito.Mockito.mock;

/**
 * Wires the real service graph over a mocked {@link CollectionStorage}, with request index
 * validation switched on so every mutation is checked against a full recomputation.
 */
final class ServiceFixture {

    final WorkbenchProperties properties = new WorkbenchProperties();
    final CollectionStorage storage = mock(CollectionStorage.class);
    final RequestIndexer indexer;
    final CollectionNormalizer normalizer;
    final CollectionStore store;
    final RequestPatchEngine patchEngine = new RequestPatchEngine();
    final EffectiveViewCache viewCache = new EffectiveViewCache();
    final IdGenerator idGenerator = new IdGenerator();
    final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    final FolderService folderService;
    final RequestService requestService;
    final ExportService exportService;
    final ImportService importService;
    final MergeService mergeService;
    final CollectionService collectionService;
    final EnvironmentService environmentService;

    ServiceFixture() {
        properties.setValidateIndex(true);
        indexer = new RequestIndexer(properties);
        normalizer = new CollectionNormalizer(indexer);
        store = new CollectionStore(storage, normalizer, indexer, new CollectionSanitizer(), properties);

        folderService = new FolderService(store, indexer, patchEngine, viewCache, idGenerator,
                Mappers.getMapper(FolderMapper.class), Mappers.getMapper(RequestMapper.class));
        requestService = new RequestService(store, indexer, patchEngine, viewCache, idGenerator);
        exportService = new ExportService(store, new CollectionSanitizer(), objectMapper);
        importService = new ImportService(store, idGenerator, objectMapper);
        mergeService = new MergeService(store, indexer, viewCache, idGenerator);
        collectionService = new CollectionService(store, viewCache, idGenerator,
                Mappers.getMapper(CollectionMapper.class), exportService, importService);
        environmentService = new EnvironmentService(store, idGenerator, Mappers.getMapper(EnvironmentMapper.class));
    }

    String newCollection(String name) {
        return collectionService.addCollection(new CreateCollectionRequest(name, null)).id();
    }

    String newFolder(String collectionId, String parentId, String name) {
        return folderService.createFolder(collectionId, new CreateFolderRequest(parentId, name)).id();
    }

    Request newRequest(String collectionId, String folderId, String name, HttpMethod method, String url) {
        return requestService.createRequest(collectionId, new CreateRequestRequest(folderId, name, method, url, null));
    }

    Collection snapshot(String collectionId) {
        return store.snapshot(collectionId);
    }
}
