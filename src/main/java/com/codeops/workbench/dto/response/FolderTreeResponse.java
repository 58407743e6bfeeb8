package com.codeops.workbench.dto.response;

import java.util.List;

public record FolderTreeResponse(
        String id,
        String name,
        int order,
        List<FolderTreeResponse> subFolders,
        List<RequestSummaryResponse> requests
) {}
