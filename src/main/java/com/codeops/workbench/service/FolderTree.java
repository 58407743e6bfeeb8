package com.codeops.workbench.service;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Folder;
import com.codeops.workbench.exception.InvariantViolationException;
import com.codeops.workbench.exception.NotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless primitives over a collection's folder arena: ancestry walks, cycle checks
 * and sibling ordering. Callers hold the store lock while calling these.
 */
public final class FolderTree {

    private FolderTree() {}

    /**
     * Returns the folder ids from root down to {@code folderId}, inclusive.
     * The walk is bounded by the folder count plus one; exceeding the bound means
     * the parent chain is cyclic.
     *
     * @param collection the collection
     * @param folderId   the folder to resolve
     * @return the ancestry, root first
     * @throws NotFoundException           if {@code folderId} or a folder on its chain does not exist
     * @throws InvariantViolationException if the chain does not reach root
     */
    public static List<String> ancestryOf(Collection collection, String folderId) {
        List<String> ancestry = walkToRoot(collection.getFolders(), folderId);
        if (ancestry == null) {
            throw new InvariantViolationException("Folder " + folderId + " in collection "
                    + collection.getId() + " does not reach root");
        }
        return ancestry;
    }

    /**
     * Tolerant variant of {@link #ancestryOf} used while repairing untrusted trees.
     *
     * @param folders  the folder arena
     * @param folderId the folder to resolve
     * @return the ancestry root first, or null if the chain is broken or cyclic
     */
    static List<String> ancestryOrNull(Map<String, Folder> folders, String folderId) {
        try {
            return walkToRoot(folders, folderId);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private static List<String> walkToRoot(Map<String, Folder> folders, String folderId) {
        List<String> chain = new ArrayList<>();
        String current = folderId;
        int guard = folders.size() + 1;
        while (current != null) {
            if (guard-- <= 0) {
                return null;
            }
            Folder folder = folders.get(current);
            if (folder == null) {
                throw new NotFoundException("Folder not found: " + current);
            }
            chain.add(current);
            if (AppConstants.ROOT_FOLDER_ID.equals(current)) {
                Collections.reverse(chain);
                return chain;
            }
            current = folder.getParentId();
        }
        return null;
    }

    /**
     * Returns whether making {@code targetParentId} the parent of {@code movingFolderId}
     * would create a cycle, that is whether the moving folder is the target or one of its ancestors.
     *
     * @param collection     the collection
     * @param movingFolderId the folder being moved
     * @param targetParentId the proposed new parent
     * @return true if the move must be rejected
     */
    public static boolean wouldCreateCycle(Collection collection, String movingFolderId, String targetParentId) {
        return ancestryOf(collection, targetParentId).contains(movingFolderId);
    }

    /**
     * Assigns {@code order} 1..N to the children of {@code parentId} in list order
     * and points their {@code parentId} back at the parent.
     *
     * @param collection the collection
     * @param parentId   the parent folder
     */
    public static void resequenceSiblings(Collection collection, String parentId) {
        Folder parent = require(collection, parentId);
        List<String> children = parent.getChildFolderIds();
        for (int i = 0; i < children.size(); i++) {
            Folder child = collection.getFolders().get(children.get(i));
            if (child != null) {
                child.setOrder(i + 1);
                child.setParentId(parentId);
            }
        }
    }

    /**
     * Inserts {@code childId} into the parent's child list and resequences.
     * A null, negative or out-of-range position appends.
     *
     * @param collection the collection
     * @param parentId   the new parent
     * @param childId    the folder being attached
     * @param position   zero-based insert position, or null
     */
    public static void insertChild(Collection collection, String parentId, String childId, Integer position) {
        Folder parent = require(collection, parentId);
        List<String> children = parent.getChildFolderIds();
        children.remove(childId);
        children.add(clamp(position, children.size()), childId);
        resequenceSiblings(collection, parentId);
    }

    /**
     * Detaches {@code childId} from its parent's child list and resequences the remaining siblings.
     *
     * @param collection the collection
     * @param parentId   the current parent
     * @param childId    the folder being detached
     */
    public static void removeChild(Collection collection, String parentId, String childId) {
        Folder parent = collection.getFolders().get(parentId);
        if (parent == null) {
            return;
        }
        parent.getChildFolderIds().remove(childId);
        resequenceSiblings(collection, parentId);
    }

    /**
     * Collects {@code folderId} and every folder beneath it, depth first.
     *
     * @param collection the collection
     * @param folderId   the subtree root
     * @return the subtree folder ids, subtree root first
     */
    public static Set<String> collectSubtree(Collection collection, String folderId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(folderId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            Folder folder = collection.getFolders().get(current);
            if (folder == null) {
                continue;
            }
            List<String> children = folder.getChildFolderIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return visited;
    }

    /**
     * Resolves a folder or fails.
     *
     * @param collection the collection
     * @param folderId   the folder id
     * @return the live folder
     * @throws NotFoundException if the folder does not exist
     */
    public static Folder require(Collection collection, String folderId) {
        Folder folder = folderId == null ? null : collection.getFolders().get(folderId);
        if (folder == null) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        return folder;
    }

    static int clamp(Integer position, int size) {
        if (position == null || position < 0 || position > size) {
            return size;
        }
        return position;
    }
}
