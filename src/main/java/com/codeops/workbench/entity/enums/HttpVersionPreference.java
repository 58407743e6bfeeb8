package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum HttpVersionPreference {
    @JsonProperty("auto") AUTO,
    @JsonProperty("http1") HTTP1,
    @JsonProperty("http2") HTTP2
}
