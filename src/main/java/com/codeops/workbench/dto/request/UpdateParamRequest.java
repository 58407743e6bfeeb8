package com.codeops.workbench.dto.request;

/**
 * Partial update of one parameter entry. Null fields keep their current value.
 */
public record UpdateParamRequest(
        String name,
        String value,
        Boolean enabled,
        Boolean secure
) {}
