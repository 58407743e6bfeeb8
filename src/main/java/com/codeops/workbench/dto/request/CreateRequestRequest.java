package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.enums.HttpMethod;
import jakarta.validation.constraints.Size;

/**
 * Request creation. A null {@code folderId} places the request under root and a
 * null {@code position} appends it.
 */
public record CreateRequestRequest(
        String folderId,
        @Size(max = 200) String name,
        HttpMethod method,
        @Size(max = 2000) String url,
        Integer position
) {}
