package com.codeops.workbench.dto.response;

public record MergeResultResponse(
        int addedRequests,
        int updatedRequests,
        int addedEnvironments,
        int updatedEnvironments
) {}
