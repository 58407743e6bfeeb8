package com.codeops.workbench.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Moves a scratch request into a regular collection. A null {@code folderId} targets root
 * and a null {@code name} keeps the request's current name.
 */
public record SaveScratchRequestRequest(
        @NotBlank String collectionId,
        String folderId,
        @Size(max = 200) String name
) {}
