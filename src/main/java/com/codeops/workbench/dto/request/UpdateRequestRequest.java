package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.enums.HttpMethod;
import jakarta.validation.constraints.Size;

/**
 * Direct update of a request's saved fields, bypassing the draft. A non-null
 * {@code folderId} different from the current one moves the request.
 */
public record UpdateRequestRequest(
        @Size(max = 200) String name,
        HttpMethod method,
        @Size(max = 2000) String url,
        String folderId,
        Boolean autoSave,
        String environmentId,
        AuthConfig authentication,
        String tests
) {}
