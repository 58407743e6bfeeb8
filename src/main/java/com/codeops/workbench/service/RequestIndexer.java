package com.codeops.workbench.service;

import com.codeops.workbench.config.WorkbenchProperties;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.RequestLocation;
import com.codeops.workbench.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maintains a collection's request index, the denormalized map from request id to
 * owning folder and ancestry. Every structural mutation keeps it in step with the tree.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RequestIndexer {

    private final WorkbenchProperties properties;

    /**
     * Recomputes every entry from scratch.
     *
     * @param collection the collection whose index is replaced
     */
    public void rebuildIndex(Collection collection) {
        Map<String, RequestLocation> index = new LinkedHashMap<>();
        for (Request request : collection.getRequests().values()) {
            index.put(request.getId(), locate(collection, request.getFolderId()));
        }
        collection.setRequestIndex(index);
    }

    /**
     * Recomputes the entry of a single request, or drops it if the request is gone.
     *
     * @param collection the collection
     * @param requestId  the request whose folder membership changed
     */
    public void updateEntry(Collection collection, String requestId) {
        Request request = collection.getRequests().get(requestId);
        if (request == null) {
            removeEntry(collection, requestId);
            return;
        }
        collection.getRequestIndex().put(requestId, locate(collection, request.getFolderId()));
    }

    /**
     * Recomputes the entries of every request in the subtree under {@code folderId}, breadth first.
     *
     * @param collection the collection
     * @param folderId   the folder whose ancestry changed
     */
    public void updateSubtree(Collection collection, String folderId) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(folderId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            Folder folder = collection.getFolders().get(current);
            if (folder == null) {
                continue;
            }
            folder.getRequestIds().forEach(id -> updateEntry(collection, id));
            queue.addAll(folder.getChildFolderIds());
        }
    }

    public void removeEntry(Collection collection, String requestId) {
        collection.getRequestIndex().remove(requestId);
    }

    /**
     * Compares every entry with a fresh computation when index validation is enabled.
     *
     * @param collection the collection to check
     * @throws InvariantViolationException on the first mismatching, missing or stale entry
     */
    public void verify(Collection collection) {
        if (!properties.isValidateIndex()) {
            return;
        }
        Map<String, RequestLocation> index = collection.getRequestIndex();
        if (index.size() != collection.getRequests().size()) {
            fail(collection, "index has " + index.size() + " entries for "
                    + collection.getRequests().size() + " requests");
        }
        for (Request request : collection.getRequests().values()) {
            RequestLocation expected = locate(collection, request.getFolderId());
            RequestLocation actual = index.get(request.getId());
            if (!Objects.equals(expected, actual)) {
                fail(collection, "entry for request " + request.getId() + " is " + actual
                        + ", expected " + expected);
            }
        }
    }

    private RequestLocation locate(Collection collection, String folderId) {
        List<String> ancestry = FolderTree.ancestryOf(collection, folderId);
        return new RequestLocation(folderId, ancestry);
    }

    private void fail(Collection collection, String detail) {
        log.error("Request index mismatch in collection {}: {}", collection.getId(), detail);
        throw new InvariantViolationException("Request index mismatch in collection "
                + collection.getId() + ": " + detail);
    }
}
