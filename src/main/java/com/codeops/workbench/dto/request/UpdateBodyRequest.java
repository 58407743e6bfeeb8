package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.enums.BodyLanguage;
import com.codeops.workbench.entity.enums.BodyType;
import com.codeops.workbench.entity.enums.FormEncoding;
import lombok.Builder;

import java.util.Map;

/**
 * Partial body update. A null {@code formData} value deletes that field from the draft.
 */
@Builder
public record UpdateBodyRequest(
        BodyType type,
        BodyLanguage language,
        String content,
        FormEncoding encoding,
        Map<String, UpdateFormFieldRequest> formData,
        String binaryPath,
        String binaryFileName,
        String binaryContentType
) {}
