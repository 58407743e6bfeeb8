package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.request.UpdateCollectionRequest;
import com.codeops.workbench.dto.response.CollectionSummaryResponse;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.BearerAuth;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.enums.AuthType;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for CollectionService lifecycle operations and the scratch collection.
 */
class CollectionServiceTest {

    private ServiceFixture fixture;
    private CollectionService collectionService;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        collectionService = fixture.collectionService;
    }

    @Test
    void listCollections_fresh_onlyScratch() {
        List<CollectionSummaryResponse> result = collectionService.listCollections();

        assertThat(result).singleElement().satisfies(summary -> {
            assertThat(summary.id()).isEqualTo(AppConstants.SCRATCH_COLLECTION_ID);
            assertThat(summary.order()).isZero();
        });
    }

    @Test
    void addCollection_success() {
        CollectionSummaryResponse created = collectionService.addCollection(new CreateCollectionRequest("Payments", "desc"));

        assertThat(created.name()).isEqualTo("Payments");
        assertThat(created.order()).isEqualTo(1);
        assertThat(created.requestCount()).isZero();
        Collection collection = collectionService.getCollection(created.id());
        assertThat(collection.getFolders()).containsOnlyKeys(AppConstants.ROOT_FOLDER_ID);
        assertThat(collection.getAuthentication().getType()).isEqualTo(AuthType.NONE);
    }

    @Test
    void addCollection_blankName_throwsValidation() {
        assertThatThrownBy(() -> collectionService.addCollection(new CreateCollectionRequest(" ", null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void getCollection_unknown_throwsNotFound() {
        assertThatThrownBy(() -> collectionService.getCollection("nope"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void getCollection_scratchWithoutFile_constructedEmpty() {
        Collection scratch = collectionService.getCollection(AppConstants.SCRATCH_COLLECTION_ID);

        assertThat(scratch.getName()).isEqualTo(AppConstants.SCRATCH_COLLECTION_NAME);
        assertThat(scratch.getFolders().get(AppConstants.ROOT_FOLDER_ID).getName())
                .isEqualTo(AppConstants.SCRATCH_ROOT_FOLDER_NAME);
    }

    @Test
    void getCollection_returnsDetachedSnapshot() {
        String id = fixture.newCollection("A");
        Collection snapshot = collectionService.getCollection(id);
        snapshot.setName("mutated");
        snapshot.getFolders().clear();

        Collection again = collectionService.getCollection(id);
        assertThat(again.getName()).isEqualTo("A");
        assertThat(again.getFolders()).isNotEmpty();
    }

    @Test
    void requestCount_trackedAfterMutations() {
        String id = fixture.newCollection("A");
        fixture.newRequest(id, null, "R1", HttpMethod.GET, "https://1");
        fixture.newRequest(id, null, "R2", HttpMethod.GET, "https://2");

        assertThat(collectionService.getCollectionSummary(id).requestCount()).isEqualTo(2);
    }

    @Test
    void updateCollection_nameAndAuthentication() {
        String id = fixture.newCollection("A");

        CollectionSummaryResponse updated = collectionService.updateCollection(id,
                new UpdateCollectionRequest("B", null, AuthConfig.builder()
                        .type(AuthType.BEARER).bearer(BearerAuth.builder().token("t").build()).build()));

        assertThat(updated.name()).isEqualTo("B");
        assertThat(collectionService.getCollection(id).getAuthentication().getType()).isEqualTo(AuthType.BEARER);
    }

    @Test
    void updateCollection_inheritAuthentication_throwsValidation() {
        String id = fixture.newCollection("A");

        assertThatThrownBy(() -> collectionService.updateCollection(id,
                new UpdateCollectionRequest(null, null, AuthConfig.inherit())))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void removeCollection_deletesFile() {
        String id = fixture.newCollection("A");

        collectionService.removeCollection(id);

        verify(fixture.storage).delete(id);
        assertThat(collectionService.listCollections()).extracting(CollectionSummaryResponse::id).doesNotContain(id);
    }

    @Test
    void removeCollection_scratch_throwsValidation() {
        assertThatThrownBy(() -> collectionService.removeCollection(AppConstants.SCRATCH_COLLECTION_ID))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void reorderCollections_scratchStaysFirst() {
        String a = fixture.newCollection("A");
        String b = fixture.newCollection("B");
        String c = fixture.newCollection("C");

        List<CollectionSummaryResponse> result = collectionService.reorderCollections(
                List.of(c, AppConstants.SCRATCH_COLLECTION_ID, "unknown", a));

        assertThat(result).extracting(CollectionSummaryResponse::id)
                .containsExactly(AppConstants.SCRATCH_COLLECTION_ID, c, a, b);
        assertThat(result).extracting(CollectionSummaryResponse::order).containsExactly(0, 1, 2, 3);
    }

    @Test
    void clearScratchCollection_removesEveryRequest() {
        fixture.newRequest(AppConstants.SCRATCH_COLLECTION_ID, null, "A", HttpMethod.GET, "https://a");
        fixture.newRequest(AppConstants.SCRATCH_COLLECTION_ID, null, "B", HttpMethod.GET, "https://b");

        assertThat(collectionService.clearScratchCollection()).isEqualTo(2);
        assertThat(collectionService.getCollection(AppConstants.SCRATCH_COLLECTION_ID).getRequests()).isEmpty();
    }

    @Test
    void saveCollection_writesSanitizedCollectionAndIndex() {
        String id = fixture.newCollection("A");
        collectionService.updateCollection(id, new UpdateCollectionRequest(null, null, AuthConfig.builder()
                .type(AuthType.BEARER).bearer(BearerAuth.builder().token("secret").build()).build()));

        collectionService.saveCollection(id);

        ArgumentCaptor<Collection> saved = ArgumentCaptor.forClass(Collection.class);
        verify(fixture.storage).save(saved.capture());
        assertThat(saved.getValue().getAuthentication().getBearer().getToken()).isNull();
        assertThat(saved.getValue().getRequestIndex()).isNull();
        verify(fixture.storage).saveIndex(anyList());
        assertThat(collectionService.getCollection(id).getAuthentication().getBearer().getToken()).isEqualTo("secret");
    }

    @Test
    void duplicateCollection_freshIdsSameShape() {
        String id = fixture.newCollection("Orders");
        String folder = fixture.newFolder(id, null, "F");
        Request r = fixture.newRequest(id, folder, "R", HttpMethod.GET, "https://r");

        CollectionSummaryResponse copy = collectionService.duplicateCollection(id);

        assertThat(copy.id()).isNotEqualTo(id);
        assertThat(copy.name()).isEqualTo("Copy of Orders");
        assertThat(copy.requestCount()).isEqualTo(1);
        Collection duplicated = collectionService.getCollection(copy.id());
        assertThat(duplicated.getRequests()).doesNotContainKey(r.getId());
        assertThat(duplicated.getFolders()).hasSize(2).doesNotContainKey(folder);
        assertThat(duplicated.getRequests().values()).singleElement()
                .satisfies(request -> assertThat(request.getName()).isEqualTo("R"));
    }
}
