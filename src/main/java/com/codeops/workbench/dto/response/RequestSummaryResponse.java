package com.codeops.workbench.dto.response;

import com.codeops.workbench.entity.enums.HttpMethod;

public record RequestSummaryResponse(
        String id,
        String name,
        HttpMethod method,
        String url,
        Integer order,
        boolean dirty
) {}
