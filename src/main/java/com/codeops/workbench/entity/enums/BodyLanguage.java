package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grammar of a text request body, used by editors and content-type inference.
 */
public enum BodyLanguage {
    @JsonProperty("json") JSON,
    @JsonProperty("yaml") YAML,
    @JsonProperty("xml") XML,
    @JsonProperty("html") HTML,
    @JsonProperty("graphql") GRAPHQL,
    @JsonProperty("javascript") JAVASCRIPT,
    @JsonProperty("text") TEXT,
    @JsonProperty("css") CSS
}
