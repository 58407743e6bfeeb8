package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FormFieldKind {
    @JsonProperty("text") TEXT,
    @JsonProperty("file") FILE
}
