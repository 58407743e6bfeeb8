package com.codeops.workbench.storage;

import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.CollectionIndexEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistent home of the collections index and of each collection document.
 * Returned collections are raw and must be normalized before use.
 */
public interface CollectionStorage {

    Optional<List<CollectionIndexEntry>> loadIndex();

    void saveIndex(List<CollectionIndexEntry> entries);

    /**
     * Reads one collection.
     *
     * @param collectionId the collection id
     * @return the stored collection, or empty if none is stored under that id
     */
    Optional<Collection> load(String collectionId);

    void save(Collection collection);

    void delete(String collectionId);
}
