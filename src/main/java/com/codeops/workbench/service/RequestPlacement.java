package com.codeops.workbench.service;

import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.exception.InvariantViolationException;
import com.codeops.workbench.exception.NotFoundException;

import java.util.List;

/**
 * Moves requests in and out of folders while keeping {@code requestIds}, request
 * {@code order} and the request index in step. Both the folder a request leaves and the one it
 * enters are renumbered 1..N.
 */
final class RequestPlacement {

    private RequestPlacement() {}

    static Request require(Collection collection, String requestId) {
        Request request = requestId == null ? null : collection.getRequests().get(requestId);
        if (request == null) {
            throw new NotFoundException("Request not found: " + requestId);
        }
        return request;
    }

    /**
     * Puts {@code request} into {@code folderId} at {@code position} and renumbers that folder's requests 1..N.
     *
     * @param collection the collection
     * @param indexer    the request indexer
     * @param folderId   the target folder, which must exist
     * @param request    the request, registered in the collection if it is not already
     * @param position   zero-based position, null or out of range to append
     */
    static void insert(Collection collection, RequestIndexer indexer, String folderId, Request request, Integer position) {
        Folder folder = FolderTree.require(collection, folderId);
        request.setFolderId(folderId);
        request.setCollectionId(collection.getId());
        collection.getRequests().put(request.getId(), request);

        List<String> ids = folder.getRequestIds();
        ids.remove(request.getId());
        ids.add(FolderTree.clamp(position, ids.size()), request.getId());
        for (int i = 0; i < ids.size(); i++) {
            Request sibling = collection.getRequests().get(ids.get(i));
            if (sibling != null) {
                sibling.setOrder(i + 1);
                sibling.setFolderId(folderId);
                indexer.updateEntry(collection, sibling.getId());
            }
        }
    }

    /**
     * Takes a request out of its folder's listing and the index, and renumbers the requests
     * left behind. The request entity stays registered.
     *
     * @param collection the collection
     * @param indexer    the request indexer
     * @param requestId  the request
     * @return the detached request
     */
    static Request detach(Collection collection, RequestIndexer indexer, String requestId) {
        Request request = require(collection, requestId);
        Folder folder = collection.getFolders().get(request.getFolderId());
        if (folder == null || !folder.getRequestIds().remove(requestId)) {
            throw new InvariantViolationException("Request " + requestId + " is not listed in its folder "
                    + request.getFolderId());
        }
        indexer.removeEntry(collection, requestId);
        List<String> remaining = folder.getRequestIds();
        for (int i = 0; i < remaining.size(); i++) {
            Request sibling = collection.getRequests().get(remaining.get(i));
            if (sibling != null) {
                sibling.setOrder(i + 1);
            }
        }
        return request;
    }
}
