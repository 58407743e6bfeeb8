package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a token or credential is injected into an outgoing request.
 */
public enum AuthPlacementType {
    @JsonProperty("header") HEADER,
    @JsonProperty("query") QUERY,
    @JsonProperty("cookie") COOKIE,
    @JsonProperty("body") BODY
}
