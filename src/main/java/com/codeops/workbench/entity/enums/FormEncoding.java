package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FormEncoding {
    @JsonProperty("url") URL,
    @JsonProperty("multipart") MULTIPART,
    @JsonProperty("plain") PLAIN
}
