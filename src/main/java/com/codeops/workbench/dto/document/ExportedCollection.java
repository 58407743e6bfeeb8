package com.codeops.workbench.dto.document;

import com.codeops.workbench.entity.Collection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Native export document. Its collection is untrusted on the way in and is only used
 * after passing through import or merge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportedCollection(
        String format,
        String version,
        Instant exportedAt,
        Collection collection
) {}
