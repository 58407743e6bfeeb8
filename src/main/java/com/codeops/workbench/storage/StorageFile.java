package com.codeops.workbench.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * On-disk envelope of every stored document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageFile(Header header, JsonNode content) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Header(int version, Instant updated) {}
}
