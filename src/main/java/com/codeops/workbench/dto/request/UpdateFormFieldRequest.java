package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.enums.FormFieldKind;
import lombok.Builder;

@Builder
public record UpdateFormFieldRequest(
        String key,
        String value,
        Boolean enabled,
        Boolean secure,
        FormFieldKind kind,
        String fileName,
        String contentType,
        String filePath
) {}
