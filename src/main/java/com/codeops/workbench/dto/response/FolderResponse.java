package com.codeops.workbench.dto.response;

import java.util.List;

public record FolderResponse(
        String id,
        String collectionId,
        String parentId,
        String name,
        int order,
        List<String> childFolderIds,
        List<String> requestIds
) {}
