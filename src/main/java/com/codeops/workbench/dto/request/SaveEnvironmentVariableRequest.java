package com.codeops.workbench.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SaveEnvironmentVariableRequest(
        @NotBlank @Size(max = 500) String name,
        String value,
        Boolean secure
) {}
