package com.codeops.workbench.service;

import com.codeops.workbench.entity.Request;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Caches computed effective views. An entry is served only while the request's
 * {@code updated} counter, folder and order still match the values it was computed from.
 */
@Component
public class EffectiveViewCache {

    private record Entry(long updated, String folderId, Integer order, Request view) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Returns a copy of the cached view of {@code request}, computing it when stale.
     *
     * @param collectionId the owning collection
     * @param request      the live request
     * @param compute      computes a fresh view
     * @return an independent copy of the effective view
     */
    public Request get(String collectionId, Request request, Supplier<Request> compute) {
        String key = key(collectionId, request.getId());
        Entry entry = entries.get(key);
        if (entry == null || entry.updated() != request.getUpdated()
                || !Objects.equals(entry.folderId(), request.getFolderId())
                || !Objects.equals(entry.order(), request.getOrder())) {
            entry = new Entry(request.getUpdated(), request.getFolderId(), request.getOrder(), compute.get());
            entries.put(key, entry);
        }
        return entry.view().copy();
    }

    public void evict(String collectionId, String requestId) {
        entries.remove(key(collectionId, requestId));
    }

    public void evictCollection(String collectionId) {
        String prefix = collectionId + "/";
        entries.keySet().removeIf(k -> k.startsWith(prefix));
    }

    int size() {
        return entries.size();
    }

    private static String key(String collectionId, String requestId) {
        return collectionId + "/" + requestId;
    }
}
