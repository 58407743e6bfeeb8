package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.AuthConfig;
import jakarta.validation.constraints.Size;

public record UpdateCollectionRequest(
        @Size(max = 200) String name,
        @Size(max = 2000) String description,
        AuthConfig authentication
) {}
