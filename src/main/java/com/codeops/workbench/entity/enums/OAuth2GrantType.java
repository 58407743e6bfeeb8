package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OAuth2GrantType {
    @JsonProperty("client_credentials") CLIENT_CREDENTIALS,
    @JsonProperty("password") PASSWORD,
    @JsonProperty("refresh_token") REFRESH_TOKEN,
    @JsonProperty("device_code") DEVICE_CODE
}
