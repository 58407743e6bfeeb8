package com.codeops.workbench.store;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.config.WorkbenchProperties;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.CollectionIndexEntry;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.StorageException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.service.CollectionNormalizer;
import com.codeops.workbench.service.RequestIndexer;
import com.codeops.workbench.storage.CollectionSanitizer;
import com.codeops.workbench.storage.CollectionStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CollectionStore loading, locking wrappers and save bookkeeping.
 */
@ExtendWith(MockitoExtension.class)
class CollectionStoreTest {

    @Mock
    private CollectionStorage storage;

    private CollectionStore store;

    @BeforeEach
    void setUp() {
        WorkbenchProperties properties = new WorkbenchProperties();
        properties.setValidateIndex(true);
        RequestIndexer indexer = new RequestIndexer(properties);
        store = new CollectionStore(storage, new CollectionNormalizer(indexer), indexer,
                new CollectionSanitizer(), properties);
    }

    @Test
    void load_noStoredIndex_addsScratchEntry() {
        when(storage.loadIndex()).thenReturn(Optional.empty());

        assertThat(store.load()).isEmpty();
        assertThat(store.listIndex()).extracting(CollectionIndexEntry::getId)
                .containsExactly(AppConstants.SCRATCH_COLLECTION_ID);
    }

    @Test
    void ensureLoaded_storedCollection_normalizedOnLoad() {
        when(storage.loadIndex()).thenReturn(Optional.of(List.of(
                CollectionIndexEntry.builder().id("c1").name("C1").order(1).build())));
        Collection stored = Collection.builder().id("c1").name("C1").build();
        stored.getRequests().put("r1", Request.builder().folderId("gone").build());
        when(storage.load("c1")).thenReturn(Optional.of(stored));

        Collection snapshot = store.snapshot("c1");

        assertThat(snapshot.getFolders()).containsKey(AppConstants.ROOT_FOLDER_ID);
        assertThat(snapshot.getRequests().get("r1").getFolderId()).isEqualTo(AppConstants.ROOT_FOLDER_ID);
        assertThat(snapshot.getRequestIndex()).containsKey("r1");
        assertThat(store.indexEntry("c1").getCount()).isEqualTo(1);
    }

    @Test
    void ensureLoaded_unknownId_throwsNotFound() {
        when(storage.loadIndex()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.snapshot("nope")).isInstanceOf(NotFoundException.class);
        verify(storage, never()).load(any());
    }

    @Test
    void mutate_stampsAndMarksDirty() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        when(storage.load(AppConstants.SCRATCH_COLLECTION_ID)).thenReturn(Optional.empty());
        long before = store.state();

        store.update(AppConstants.SCRATCH_COLLECTION_ID, c -> c.setDescription("changed"));

        assertThat(store.state()).isGreaterThan(before);
        assertThat(store.shouldSave(before, store.state())).isTrue();
        assertThat(store.snapshot(AppConstants.SCRATCH_COLLECTION_ID).getUpdated()).isNotNull();
    }

    @Test
    void add_duplicateId_throwsValidation() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        store.add(collection("c1"));

        assertThatThrownBy(() -> store.add(collection("c1"))).isInstanceOf(ValidationException.class);
    }

    @Test
    void save_writesOnlyDirtyCollectionsThenNothing() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        store.add(collection("c1"));

        store.save(false);
        store.save(false);

        verify(storage, times(1)).save(any(Collection.class));
        verify(storage, times(1)).saveIndex(anyList());
    }

    @Test
    void save_failure_keepsCollectionPending() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        store.add(collection("c1"));
        doThrow(new StorageException("disk full")).doNothing().when(storage).save(any(Collection.class));

        assertThatThrownBy(() -> store.save(false)).isInstanceOf(StorageException.class);
        store.save(false);

        ArgumentCaptor<Collection> captor = ArgumentCaptor.forClass(Collection.class);
        verify(storage, times(2)).save(captor.capture());
        assertThat(captor.getAllValues()).extracting(Collection::getId).containsOnly("c1");
    }

    @Test
    void remove_deletesAndForgets() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        store.add(collection("c1"));

        store.remove("c1");

        verify(storage).delete("c1");
        assertThat(store.contains("c1")).isFalse();
        assertThatThrownBy(() -> store.remove("c1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void mutateBoth_appliesToBothCollections() {
        when(storage.loadIndex()).thenReturn(Optional.empty());
        store.add(collection("a"));
        store.add(collection("b"));

        store.mutateBoth("a", "b", (a, b) -> {
            a.setDescription("from a");
            b.setDescription("from b");
            return null;
        });

        assertThat(store.snapshot("a").getDescription()).isEqualTo("from a");
        assertThat(store.snapshot("b").getDescription()).isEqualTo("from b");
    }

    @Test
    void listIndex_scratchFirstThenOrder() {
        when(storage.loadIndex()).thenReturn(Optional.of(List.of(
                CollectionIndexEntry.builder().id("b").name("B").order(2).created(Instant.EPOCH).build(),
                CollectionIndexEntry.builder().id("a").name("A").order(1).created(Instant.EPOCH).build())));

        assertThat(store.listIndex()).extracting(CollectionIndexEntry::getId)
                .containsExactly(AppConstants.SCRATCH_COLLECTION_ID, "a", "b");
    }

    private static Collection collection(String id) {
        Collection collection = Collection.builder().id(id).name(id.toUpperCase()).build();
        collection.getFolders().put(AppConstants.ROOT_FOLDER_ID,
                Folder.builder().id(AppConstants.ROOT_FOLDER_ID).name(AppConstants.ROOT_FOLDER_NAME).build());
        return collection;
    }
}
