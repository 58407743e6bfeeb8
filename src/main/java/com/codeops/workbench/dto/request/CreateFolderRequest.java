package com.codeops.workbench.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Folder creation. A null {@code parentId} creates the folder under root.
 */
public record CreateFolderRequest(
        String parentId,
        @NotBlank @Size(max = 200) String name
) {}
