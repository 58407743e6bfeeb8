package com.codeops.workbench.dto.response;

public record EnvironmentResponse(
        String id,
        String name,
        String description,
        boolean isActive,
        int variableCount
) {}
