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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ImportService parsing, id remapping and ordering.
 */
class ImportServiceTest {

    private ServiceFixture fixture;
    private ImportService importService;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        importService = fixture.importService;
    }

    private static ExportedCollection document(Collection collection) {
        return new ExportedCollection(AppConstants.EXPORT_FORMAT, AppConstants.EXPORT_VERSION, Instant.now(), collection);
    }

    /** root -> f1 with requests r2, r1 in that listed order; r3 points at a folder that does not exist. */
    private static Collection exported() {
        Collection collection = Collection.builder()
                .id("src")
                .name("Exported")
                .authentication(AuthConfig.inherit())
                .activeEnvironmentId("e1")
                .build();
        collection.getFolders().put("root", Folder.builder().id("root").name("Root")
                .childFolderIds(new ArrayList<>(List.of("f1"))).build());
        collection.getFolders().put("f1", Folder.builder().id("f1").name("Users").parentId("root")
                .requestIds(new ArrayList<>(List.of("r2", "r1"))).build());
        collection.getRequests().put("r1", Request.builder().id("r1").folderId("f1").order(1)
                .name("One").method(HttpMethod.GET).url("https://one").build());
        collection.getRequests().put("r2", Request.builder().id("r2").folderId("f1").order(2)
                .name("Two").method(HttpMethod.POST).url("https://two").build());
        collection.getRequests().put("r3", Request.builder().id("r3").folderId("ghost")
                .name("Three").url("https://three").build());
        collection.getEnvironments().put("e1", Environment.builder().id("e1").name("Local").build());
        return collection;
    }

    @Test
    void buildSignature_methodAndTrimmedUrl() {
        assertThat(ImportService.buildSignature(HttpMethod.POST, "  https://x/y ")).isEqualTo("POST::https://x/y");
        assertThat(ImportService.buildSignature(null, null)).isEqualTo("::");
    }

    @Test
    void importAsNewCollection_remapsIdsAndKeepsListedOrder() {
        ImportResultResponse result = importService.importAsNewCollection(document(exported()), null);

        assertThat(result.collectionName()).isEqualTo("Exported");
        assertThat(result.foldersImported()).isEqualTo(1);
        assertThat(result.requestsImported()).isEqualTo(3);
        assertThat(result.environmentsImported()).isEqualTo(1);

        Collection imported = fixture.snapshot(result.collectionId());
        assertThat(imported.getRequests()).doesNotContainKeys("r1", "r2", "r3");
        assertThat(imported.getFolders()).doesNotContainKey("f1").containsKey(AppConstants.ROOT_FOLDER_ID);

        String folderId = imported.getFolders().get(AppConstants.ROOT_FOLDER_ID).getChildFolderIds().get(0);
        List<String> names = imported.getFolders().get(folderId).getRequestIds().stream()
                .map(id -> imported.getRequests().get(id).getName())
                .toList();
        assertThat(names).containsExactly("Two", "One");
        assertThat(imported.getFolders().get(folderId).getRequestIds())
                .extracting(id -> imported.getRequests().get(id).getOrder())
                .containsExactly(1, 2);
        assertThat(imported.getRequests().values()).allSatisfy(r -> assertThat(r.getCollectionId()).isEqualTo(result.collectionId()));
    }

    @Test
    void importAsNewCollection_requestInUnknownFolder_landsInRoot() {
        ImportResultResponse result = importService.importAsNewCollection(document(exported()), null);

        Collection imported = fixture.snapshot(result.collectionId());
        assertThat(imported.getFolders().get(AppConstants.ROOT_FOLDER_ID).getRequestIds())
                .singleElement()
                .satisfies(id -> assertThat(imported.getRequests().get(id).getName()).isEqualTo("Three"));
        fixture.indexer.verify(imported);
    }

    @Test
    void importAsNewCollection_inheritAuthCoercedToNone() {
        ImportResultResponse result = importService.importAsNewCollection(document(exported()), "Override");

        Collection imported = fixture.snapshot(result.collectionId());
        assertThat(imported.getName()).isEqualTo("Override");
        assertThat(imported.getAuthentication().getType()).isEqualTo(AuthType.NONE);
        assertThat(imported.getActiveEnvironmentId()).isEqualTo("e1");
    }

    @Test
    void importAsNewCollection_twice_independentCollections() {
        String first = importService.importAsNewCollection(document(exported()), null).collectionId();
        String second = importService.importAsNewCollection(document(exported()), null).collectionId();

        assertThat(first).isNotEqualTo(second);
        assertThat(fixture.snapshot(first).getRequests().keySet())
                .doesNotContainAnyElementsOf(fixture.snapshot(second).getRequests().keySet());
    }

    @Test
    void importAsNewCollection_missingRootAndName_defaults() {
        Collection bare = Collection.builder().build();
        bare.getRequests().put("r", Request.builder().id("r").url("https://r").build());

        ImportResultResponse result = importService.importAsNewCollection(document(bare), null);

        assertThat(result.collectionName()).isEqualTo(AppConstants.DEFAULT_COLLECTION_NAME);
        assertThat(fixture.snapshot(result.collectionId()).getFolders().get("root").getRequestIds()).hasSize(1);
    }

    @Test
    void importAsNewCollection_wrongFormat_throwsValidation() {
        ExportedCollection foreign = new ExportedCollection("postman", "2.1", Instant.now(), exported());

        assertThatThrownBy(() -> importService.importAsNewCollection(foreign, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("postman");
    }

    @Test
    void parseDocument_roundTripsExportJson() {
        String id = fixture.newCollection("Json");
        fixture.newRequest(id, null, "R", HttpMethod.PUT, "https://r");
        String json = fixture.exportService.toJson(fixture.exportService.exportCollection(id));

        ExportedCollection parsed = importService.parseDocument(json);

        assertThat(parsed.format()).isEqualTo(AppConstants.EXPORT_FORMAT);
        assertThat(parsed.collection().getName()).isEqualTo("Json");
        assertThat(parsed.collection().getRequests().values()).singleElement()
                .satisfies(r -> assertThat(r.getMethod()).isEqualTo(HttpMethod.PUT));
    }

    @Test
    void parseDocument_invalid_throwsValidation() {
        assertThatThrownBy(() -> importService.parseDocument("{not json"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> importService.parseDocument("{\"format\":\"native\"}"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no collection");
    }
}
