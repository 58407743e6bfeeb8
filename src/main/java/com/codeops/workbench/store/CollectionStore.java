package com.codeops.workbench.store;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.config.WorkbenchProperties;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.CollectionIndexEntry;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.StorageException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.service.CollectionNormalizer;
import com.codeops.workbench.service.RequestIndexer;
import com.codeops.workbench.storage.CollectionSanitizer;
import com.codeops.workbench.storage.CollectionStorage;
import com.codeops.workbench.storage.StorageProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owner of every resident collection and of the collections index.
 * <p>
 * All reads and writes go through {@link #read} and {@link #mutate}, which run the given
 * function while holding a single store-wide lock. Loading from storage happens before the
 * lock is taken, so a critical section never waits on I/O. Functions passed to {@code read}
 * must return copies; nothing live escapes the lock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollectionStore implements StorageProvider<Long> {

    private static final Comparator<CollectionIndexEntry> INDEX_ORDER = Comparator
            .comparing((CollectionIndexEntry e) -> !AppConstants.SCRATCH_COLLECTION_ID.equals(e.getId()))
            .thenComparingInt(CollectionIndexEntry::getOrder);

    private final CollectionStorage storage;
    private final CollectionNormalizer normalizer;
    private final RequestIndexer requestIndexer;
    private final CollectionSanitizer sanitizer;
    private final WorkbenchProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CollectionIndexEntry> index = new LinkedHashMap<>();
    private final Map<String, Collection> cache = new HashMap<>();
    private final Set<String> dirty = new LinkedHashSet<>();
    private final AtomicLong modifications = new AtomicLong();
    private volatile boolean indexLoaded;
    private boolean indexDirty;

    @Override
    public String key() {
        return "collections";
    }

    /**
     * Loads the collections index. Collections themselves load lazily on first access.
     *
     * @return the state token, or empty if no index was stored yet
     */
    @Override
    public Optional<Long> load() {
        Optional<List<CollectionIndexEntry>> stored = storage.loadIndex();
        lock.lock();
        try {
            if (!indexLoaded) {
                stored.ifPresent(entries -> entries.stream()
                        .filter(e -> e.getId() != null)
                        .forEach(e -> index.putIfAbsent(e.getId(), e)));
                if (!index.containsKey(AppConstants.SCRATCH_COLLECTION_ID)) {
                    Instant now = Instant.now();
                    index.put(AppConstants.SCRATCH_COLLECTION_ID, CollectionIndexEntry.builder()
                            .id(AppConstants.SCRATCH_COLLECTION_ID)
                            .name(AppConstants.SCRATCH_COLLECTION_NAME)
                            .order(0)
                            .created(now)
                            .updated(now)
                            .build());
                    indexDirty = true;
                }
                indexLoaded = true;
                log.info("Loaded collections index with {} entries", index.size());
            }
            return stored.map(entries -> modifications.get());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes sure {@code collectionId} is resident, reading and normalizing it outside the lock.
     * A missing scratch collection is constructed empty.
     *
     * @param collectionId the collection id
     * @throws NotFoundException if the id is not in the collections index
     */
    public void ensureLoaded(String collectionId) {
        ensureIndexLoaded();
        CollectionIndexEntry entry;
        lock.lock();
        try {
            if (cache.containsKey(collectionId)) {
                return;
            }
            entry = index.get(collectionId);
            if (entry == null) {
                throw new NotFoundException("Collection not found: " + collectionId);
            }
            entry = entry.copy();
        } finally {
            lock.unlock();
        }

        Collection loaded = storage.load(collectionId).orElse(null);
        if (loaded == null) {
            if (AppConstants.SCRATCH_COLLECTION_ID.equals(collectionId)) {
                log.info("No stored scratch collection, creating an empty one");
            } else {
                log.warn("Collection {} is indexed but has no stored file, starting it empty", collectionId);
            }
            loaded = emptyCollection(collectionId, entry.getName());
        }
        loaded.setId(collectionId);
        normalizer.normalize(loaded);

        lock.lock();
        try {
            if (!index.containsKey(collectionId)) {
                throw new NotFoundException("Collection not found: " + collectionId);
            }
            if (cache.putIfAbsent(collectionId, loaded) == null) {
                index.get(collectionId).setCount(loaded.getRequests().size());
                log.debug("Loaded collection {} with {} requests", collectionId, loaded.getRequests().size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code reader} against the live collection under the store lock.
     *
     * @param collectionId the collection id
     * @param reader       must not mutate and must return detached values
     * @param <T>          result type
     * @return the reader's result
     * @throws NotFoundException if the collection does not exist
     */
    public <T> T read(String collectionId, Function<Collection, T> reader) {
        ensureLoaded(collectionId);
        lock.lock();
        try {
            return reader.apply(live(collectionId));
        } finally {
            lock.unlock();
        }
    }

    public Collection snapshot(String collectionId) {
        return read(collectionId, Collection::copy);
    }

    /**
     * Runs {@code mutation} against the live collection under the store lock, then stamps
     * the collection, verifies the request index and marks the collection for saving.
     * Mutations validate their arguments before changing anything, so a thrown exception
     * leaves the collection untouched.
     *
     * @param collectionId the collection id
     * @param mutation     the change
     * @param <T>          result type
     * @return the mutation's result, which must be detached from live state
     * @throws NotFoundException if the collection does not exist
     */
    public <T> T mutate(String collectionId, Function<Collection, T> mutation) {
        ensureLoaded(collectionId);
        lock.lock();
        try {
            Collection collection = live(collectionId);
            T result = mutation.apply(collection);
            afterMutation(collection);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void update(String collectionId, Consumer<Collection> mutation) {
        mutate(collectionId, collection -> {
            mutation.accept(collection);
            return null;
        });
    }

    /**
     * Runs one mutation across two collections atomically, e.g. moving a request between them.
     *
     * @param sourceId the first collection
     * @param targetId the second collection
     * @param mutation receives the live source and target
     * @param <T>      result type
     * @return the mutation's result
     */
    public <T> T mutateBoth(String sourceId, String targetId,
                            BiFunction<Collection, Collection, T> mutation) {
        ensureLoaded(sourceId);
        ensureLoaded(targetId);
        lock.lock();
        try {
            Collection source = live(sourceId);
            Collection target = live(targetId);
            T result = mutation.apply(source, target);
            afterMutation(source);
            if (target != source) {
                afterMutation(target);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a new collection after normalizing it and appends it to the index.
     *
     * @param collection a collection not yet known to the store; it becomes owned by the store
     * @return a snapshot of the stored collection
     * @throws ValidationException if a collection with that id already exists
     */
    public Collection add(Collection collection) {
        ensureIndexLoaded();
        normalizer.normalize(collection);
        lock.lock();
        try {
            if (index.containsKey(collection.getId())) {
                throw new ValidationException("Collection already exists: " + collection.getId());
            }
            Instant now = Instant.now();
            collection.setUpdated(now);
            int order = AppConstants.SCRATCH_COLLECTION_ID.equals(collection.getId()) ? 0 : nextOrder();
            index.put(collection.getId(), CollectionIndexEntry.builder()
                    .id(collection.getId())
                    .name(collection.getName())
                    .order(order)
                    .count(collection.getRequests().size())
                    .created(now)
                    .updated(now)
                    .build());
            cache.put(collection.getId(), collection);
            requestIndexer.verify(collection);
            markDirty(collection.getId());
            return collection.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a collection from the index, the cache and storage.
     *
     * @param collectionId the collection id
     * @throws ValidationException if {@code collectionId} is the scratch collection
     * @throws NotFoundException   if the collection does not exist
     */
    public void remove(String collectionId) {
        if (AppConstants.SCRATCH_COLLECTION_ID.equals(collectionId)) {
            throw new ValidationException("The scratch collection cannot be removed");
        }
        ensureIndexLoaded();
        lock.lock();
        try {
            if (index.remove(collectionId) == null) {
                throw new NotFoundException("Collection not found: " + collectionId);
            }
            cache.remove(collectionId);
            dirty.remove(collectionId);
            indexDirty = true;
            modifications.incrementAndGet();
        } finally {
            lock.unlock();
        }
        storage.delete(collectionId);
    }

    public boolean contains(String collectionId) {
        ensureIndexLoaded();
        lock.lock();
        try {
            return index.containsKey(collectionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns copies of the index entries, scratch first and the rest by order.
     *
     * @return the sorted entries
     */
    public List<CollectionIndexEntry> listIndex() {
        ensureIndexLoaded();
        lock.lock();
        try {
            return index.values().stream().sorted(INDEX_ORDER).map(CollectionIndexEntry::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public CollectionIndexEntry indexEntry(String collectionId) {
        ensureIndexLoaded();
        lock.lock();
        try {
            CollectionIndexEntry entry = index.get(collectionId);
            if (entry == null) {
                throw new NotFoundException("Collection not found: " + collectionId);
            }
            return entry.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reassigns index order: the given ids first, then every unlisted collection in its
     * current order. Unknown ids are ignored and scratch keeps order 0.
     *
     * @param orderedIds the desired order
     */
    public void reorder(List<String> orderedIds) {
        ensureIndexLoaded();
        lock.lock();
        try {
            List<String> sequence = new ArrayList<>();
            for (String id : orderedIds) {
                if (index.containsKey(id) && !AppConstants.SCRATCH_COLLECTION_ID.equals(id) && !sequence.contains(id)) {
                    sequence.add(id);
                }
            }
            index.values().stream()
                    .sorted(INDEX_ORDER)
                    .map(CollectionIndexEntry::getId)
                    .filter(id -> !AppConstants.SCRATCH_COLLECTION_ID.equals(id) && !sequence.contains(id))
                    .forEach(sequence::add);
            for (int i = 0; i < sequence.size(); i++) {
                index.get(sequence.get(i)).setOrder(i + 1);
            }
            CollectionIndexEntry scratch = index.get(AppConstants.SCRATCH_COLLECTION_ID);
            if (scratch != null) {
                scratch.setOrder(0);
            }
            indexDirty = true;
            modifications.incrementAndGet();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes pending changes. Sanitized snapshots are taken under the lock and written after it
     * is released; collections that fail to write stay pending.
     *
     * @param force write every resident collection and the index even if unchanged
     */
    @Override
    public void save(boolean force) {
        Map<String, Collection> toWrite = new LinkedHashMap<>();
        List<CollectionIndexEntry> indexSnapshot = null;
        lock.lock();
        try {
            Set<String> ids = force ? cache.keySet() : dirty;
            for (String id : ids) {
                Collection collection = cache.get(id);
                if (collection != null) {
                    toWrite.put(id, sanitizer.sanitize(collection));
                }
            }
            dirty.clear();
            if (force || indexDirty) {
                indexSnapshot = index.values().stream().sorted(INDEX_ORDER).map(CollectionIndexEntry::copy).toList();
                indexDirty = false;
            }
        } finally {
            lock.unlock();
        }
        write(toWrite, indexSnapshot);
    }

    /**
     * Writes one collection and the index immediately.
     *
     * @param collectionId the collection id
     */
    public void saveNow(String collectionId) {
        Collection sanitized = read(collectionId, sanitizer::sanitize);
        List<CollectionIndexEntry> indexSnapshot;
        lock.lock();
        try {
            dirty.remove(collectionId);
            indexSnapshot = index.values().stream().sorted(INDEX_ORDER).map(CollectionIndexEntry::copy).toList();
            indexDirty = false;
        } finally {
            lock.unlock();
        }
        write(Map.of(collectionId, sanitized), indexSnapshot);
    }

    @Override
    public boolean shouldSave(Long previous, Long next) {
        return !Objects.equals(previous, next);
    }

    @Override
    public Duration throttleWait() {
        return properties.getSaveThrottle();
    }

    @Override
    public Long state() {
        return modifications.get();
    }

    private void write(Map<String, Collection> collections, List<CollectionIndexEntry> indexSnapshot) {
        for (Map.Entry<String, Collection> entry : collections.entrySet()) {
            try {
                storage.save(entry.getValue());
            } catch (StorageException e) {
                lock.lock();
                try {
                    if (index.containsKey(entry.getKey())) {
                        dirty.add(entry.getKey());
                    }
                } finally {
                    lock.unlock();
                }
                throw e;
            }
        }
        if (indexSnapshot != null) {
            try {
                storage.saveIndex(indexSnapshot);
            } catch (StorageException e) {
                lock.lock();
                try {
                    indexDirty = true;
                } finally {
                    lock.unlock();
                }
                throw e;
            }
        }
    }

    private void ensureIndexLoaded() {
        if (!indexLoaded) {
            load();
        }
    }

    private Collection live(String collectionId) {
        Collection collection = cache.get(collectionId);
        if (collection == null) {
            throw new NotFoundException("Collection not found: " + collectionId);
        }
        return collection;
    }

    private void afterMutation(Collection collection) {
        collection.setUpdated(Instant.now());
        requestIndexer.verify(collection);
        CollectionIndexEntry entry = index.get(collection.getId());
        if (entry != null) {
            entry.setName(collection.getName());
            entry.setCount(collection.getRequests().size());
            entry.setUpdated(collection.getUpdated());
        }
        markDirty(collection.getId());
    }

    private void markDirty(String collectionId) {
        dirty.add(collectionId);
        indexDirty = true;
        modifications.incrementAndGet();
    }

    private int nextOrder() {
        return index.values().stream()
                .filter(e -> !AppConstants.SCRATCH_COLLECTION_ID.equals(e.getId()))
                .mapToInt(CollectionIndexEntry::getOrder)
                .max()
                .orElse(0) + 1;
    }

    private static Collection emptyCollection(String collectionId, String name) {
        boolean scratch = AppConstants.SCRATCH_COLLECTION_ID.equals(collectionId);
        Folder root = Folder.builder()
                .id(AppConstants.ROOT_FOLDER_ID)
                .name(scratch ? AppConstants.SCRATCH_ROOT_FOLDER_NAME : AppConstants.ROOT_FOLDER_NAME)
                .build();
        Collection collection = Collection.builder()
                .id(collectionId)
                .name(scratch ? AppConstants.SCRATCH_COLLECTION_NAME : name)
                .description(scratch ? AppConstants.SCRATCH_COLLECTION_DESCRIPTION : null)
                .authentication(AuthConfig.none())
                .updated(Instant.now())
                .build();
        collection.getFolders().put(root.getId(), root);
        return collection;
    }
}
