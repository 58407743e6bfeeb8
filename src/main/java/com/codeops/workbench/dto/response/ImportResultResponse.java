package com.codeops.workbench.dto.response;

public record ImportResultResponse(
        String collectionId,
        String collectionName,
        int foldersImported,
        int requestsImported,
        int environmentsImported
) {}
