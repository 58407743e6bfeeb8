package com.codeops.workbench.entity.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authentication variants. Every type except {@link #NONE} and {@link #INHERIT}
 * carries a type-specific payload on {@link com.codeops.workbench.entity.AuthConfig}.
 */
public enum AuthType {
    @JsonProperty("none") NONE,
    @JsonProperty("inherit") INHERIT,
    @JsonProperty("basic") BASIC,
    @JsonProperty("bearer") BEARER,
    @JsonProperty("apiKey") API_KEY,
    @JsonProperty("oauth2") OAUTH2;

    /**
     * Returns whether this type stores a payload object alongside the type tag.
     *
     * @return true for basic, bearer, apiKey and oauth2
     */
    public boolean hasPayload() {
        return this != NONE && this != INHERIT;
    }
}
