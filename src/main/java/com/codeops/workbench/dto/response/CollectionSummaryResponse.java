package com.codeops.workbench.dto.response;

import java.time.Instant;

public record CollectionSummaryResponse(
        String id,
        String name,
        int order,
        int requestCount,
        Instant createdAt,
        Instant updatedAt
) {}
