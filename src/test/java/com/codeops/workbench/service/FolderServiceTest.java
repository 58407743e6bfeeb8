package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.dto.request.CreateFolderRequest;
import com.codeops.workbench.dto.response.FolderResponse;
import com.codeops.workbench.dto.response.FolderTreeResponse;
import com.codeops.workbench.dto.request.UpdateRequestPatchRequest;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FolderService covering create, rename, delete, move, reorder and tree
 * building, with the tree and index invariants checked after every change.
 */
class FolderServiceTest {

    private ServiceFixture fixture;
    private FolderService folderService;
    private String collectionId;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        folderService = fixture.folderService;
        collectionId = fixture.newCollection("API");
    }

    /** Every child list matches the parent pointers and sibling orders are 1..N. */
    private void assertTreeInvariants() {
        Collection collection = fixture.snapshot(collectionId);
        for (Folder folder : collection.getFolders().values()) {
            assertThat(FolderTree.ancestryOf(collection, folder.getId())).startsWith(AppConstants.ROOT_FOLDER_ID);
            List<String> expectedChildren = collection.getFolders().values().stream()
                    .filter(f -> folder.getId().equals(f.getParentId()))
                    .map(Folder::getId)
                    .collect(Collectors.toList());
            assertThat(folder.getChildFolderIds()).containsExactlyInAnyOrderElementsOf(expectedChildren);
            for (int i = 0; i < folder.getChildFolderIds().size(); i++) {
                assertThat(collection.getFolders().get(folder.getChildFolderIds().get(i)).getOrder()).isEqualTo(i + 1);
            }
            for (int i = 0; i < folder.getRequestIds().size(); i++) {
                assertThat(collection.getRequests().get(folder.getRequestIds().get(i)).getOrder()).isEqualTo(i + 1);
            }
        }
        fixture.indexer.verify(collection);
    }

    @Test
    void createFolder_rootLevel_success() {
        FolderResponse response = folderService.createFolder(collectionId, new CreateFolderRequest(null, "  Users "));

        assertThat(response.name()).isEqualTo("Users");
        assertThat(response.parentId()).isEqualTo(AppConstants.ROOT_FOLDER_ID);
        assertThat(response.order()).isEqualTo(1);
        assertThat(response.collectionId()).isEqualTo(collectionId);
        assertTreeInvariants();
    }

    @Test
    void createFolder_nested_appendsToParent() {
        String parent = fixture.newFolder(collectionId, null, "Parent");
        fixture.newFolder(collectionId, parent, "First");
        FolderResponse second = folderService.createFolder(collectionId, new CreateFolderRequest(parent, "Second"));

        assertThat(second.order()).isEqualTo(2);
        assertThat(folderService.getFolder(collectionId, parent).childFolderIds()).hasSize(2).endsWith(second.id());
        assertTreeInvariants();
    }

    @Test
    void createFolder_missingParent_throwsNotFound() {
        assertThatThrownBy(() -> folderService.createFolder(collectionId, new CreateFolderRequest("nope", "X")))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void createFolder_blankName_throwsValidation() {
        assertThatThrownBy(() -> folderService.createFolder(collectionId, new CreateFolderRequest(null, "  ")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void createFolder_scratchCollection_throwsValidation() {
        assertThatThrownBy(() -> folderService.createFolder(AppConstants.SCRATCH_COLLECTION_ID,
                new CreateFolderRequest(null, "X")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void renameFolder_success() {
        String id = fixture.newFolder(collectionId, null, "Old");

        assertThat(folderService.renameFolder(collectionId, id, "New").name()).isEqualTo("New");
    }

    @Test
    void renameFolder_root_throwsValidation() {
        assertThatThrownBy(() -> folderService.renameFolder(collectionId, AppConstants.ROOT_FOLDER_ID, "X"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteFolder_withNestedFolderAndRequest_removesSubtree() {
        String a = fixture.newFolder(collectionId, null, "A");
        String b = fixture.newFolder(collectionId, a, "B");
        String keep = fixture.newFolder(collectionId, null, "Keep");
        Request r = fixture.newRequest(collectionId, b, "R", HttpMethod.GET, "https://x");

        folderService.deleteFolder(collectionId, a);

        Collection collection = fixture.snapshot(collectionId);
        assertThat(collection.getFolders()).doesNotContainKeys(a, b);
        assertThat(collection.getRequests()).doesNotContainKey(r.getId());
        assertThat(collection.getRequestIndex()).doesNotContainKey(r.getId());
        assertThat(collection.getFolders().get(keep).getOrder()).isEqualTo(1);
        assertTreeInvariants();
    }

    @Test
    void deleteFolder_root_throwsValidation() {
        assertThatThrownBy(() -> folderService.deleteFolder(collectionId, AppConstants.ROOT_FOLDER_ID))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void moveFolder_underSibling_updatesAncestryOfNestedRequests() {
        String a = fixture.newFolder(collectionId, null, "A");
        String b = fixture.newFolder(collectionId, null, "B");
        String c = fixture.newFolder(collectionId, a, "C");
        Request r = fixture.newRequest(collectionId, c, "R", HttpMethod.GET, "https://x");

        FolderResponse moved = folderService.moveFolder(collectionId, a, b, 0);

        assertThat(moved.parentId()).isEqualTo(b);
        assertThat(moved.order()).isEqualTo(1);
        Collection collection = fixture.snapshot(collectionId);
        assertThat(collection.getRequestIndex().get(r.getId()).ancestry()).containsExactly("root", b, a, c);
        assertThat(collection.getFolders().get(b).getOrder()).isEqualTo(1);
        assertTreeInvariants();
    }

    @Test
    void moveFolder_underOwnDescendant_rejectedAndTreeUnchanged() {
        String a = fixture.newFolder(collectionId, null, "A");
        String b = fixture.newFolder(collectionId, a, "B");
        String d = fixture.newFolder(collectionId, b, "D");
        Collection before = fixture.snapshot(collectionId);

        assertThatThrownBy(() -> folderService.moveFolder(collectionId, a, d, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> folderService.moveFolder(collectionId, a, a, null))
                .isInstanceOf(ValidationException.class);

        Collection after = fixture.snapshot(collectionId);
        for (Map.Entry<String, Folder> entry : before.getFolders().entrySet()) {
            Folder now = after.getFolders().get(entry.getKey());
            assertThat(now.getParentId()).isEqualTo(entry.getValue().getParentId());
            assertThat(now.getChildFolderIds()).isEqualTo(entry.getValue().getChildFolderIds());
            assertThat(now.getOrder()).isEqualTo(entry.getValue().getOrder());
        }
    }

    @Test
    void moveFolder_nullParent_movesToRoot() {
        String a = fixture.newFolder(collectionId, null, "A");
        String b = fixture.newFolder(collectionId, a, "B");

        FolderResponse moved = folderService.moveFolder(collectionId, b, null, null);

        assertThat(moved.parentId()).isEqualTo(AppConstants.ROOT_FOLDER_ID);
        assertThat(moved.order()).isEqualTo(2);
        assertThat(fixture.snapshot(collectionId).getFolders().get(a).getChildFolderIds()).isEmpty();
        assertTreeInvariants();
    }

    @Test
    void moveFolder_root_throwsValidation() {
        String a = fixture.newFolder(collectionId, null, "A");

        assertThatThrownBy(() -> folderService.moveFolder(collectionId, AppConstants.ROOT_FOLDER_ID, a, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void reorderFolders_partialList_listedFirstThenRest() {
        String a = fixture.newFolder(collectionId, null, "A");
        String b = fixture.newFolder(collectionId, null, "B");
        String c = fixture.newFolder(collectionId, null, "C");

        List<FolderResponse> result = folderService.reorderFolders(collectionId, AppConstants.ROOT_FOLDER_ID,
                List.of(c, "unknown", a));

        assertThat(result).extracting(FolderResponse::id).containsExactly(c, a, b);
        assertThat(result).extracting(FolderResponse::order).containsExactly(1, 2, 3);
        assertTreeInvariants();
    }

    @Test
    void getFolderTree_showsDraftNamesAndDirtyFlag() {
        String a = fixture.newFolder(collectionId, null, "A");
        Request r = fixture.newRequest(collectionId, a, "Saved", HttpMethod.GET, "https://x");
        fixture.requestService.updateRequestPatch(collectionId, r.getId(),
                UpdateRequestPatchRequest.builder().name("Draft").build());

        FolderTreeResponse tree = folderService.getFolderTree(collectionId);

        assertThat(tree.id()).isEqualTo(AppConstants.ROOT_FOLDER_ID);
        assertThat(tree.subFolders()).hasSize(1);
        assertThat(tree.subFolders().get(0).requests()).singleElement().satisfies(summary -> {
            assertThat(summary.name()).isEqualTo("Draft");
            assertThat(summary.dirty()).isTrue();
        });
    }

    @Test
    void mergeOrder_ignoresUnknownAndKeepsRest() {
        assertThat(FolderService.mergeOrder(List.of("a", "b", "c"), List.of("c", "x", "c")))
                .containsExactly("c", "a", "b");
    }
}
