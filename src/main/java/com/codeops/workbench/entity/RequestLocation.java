package com.codeops.workbench.entity;

import java.util.List;

/**
 * Request index entry: the owning folder and the folder ids from root to it, inclusive.
 */
public record RequestLocation(String folderId, List<String> ancestry) {

    public RequestLocation {
        ancestry = List.copyOf(ancestry);
    }
}
