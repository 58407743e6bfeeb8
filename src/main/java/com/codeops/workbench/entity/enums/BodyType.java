package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BodyType {
    @JsonProperty("none") NONE,
    @JsonProperty("text") TEXT,
    @JsonProperty("form") FORM,
    @JsonProperty("binary") BINARY
}
