package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.AuthType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Tagged authentication configuration. {@link #type} selects the variant and
 * the slot named after it holds the variant's payload.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthConfig {

    private AuthType type;
    private BasicAuth basic;
    private BearerAuth bearer;
    private ApiKeyAuth apiKey;
    private OAuth2Auth oauth2;

    public static AuthConfig none() {
        return AuthConfig.builder().type(AuthType.NONE).build();
    }

    public static AuthConfig inherit() {
        return AuthConfig.builder().type(AuthType.INHERIT).build();
    }

    /**
     * Overwrites this configuration with every non-null field of {@code update}.
     *
     * @param update the partial configuration to merge in
     */
    public void mergeFrom(AuthConfig update) {
        if (update.getType() != null) {
            type = update.getType();
        }
        if (update.getBasic() != null) {
            basic = update.getBasic().toBuilder().build();
        }
        if (update.getBearer() != null) {
            bearer = update.getBearer().copy();
        }
        if (update.getApiKey() != null) {
            apiKey = update.getApiKey().copy();
        }
        if (update.getOauth2() != null) {
            oauth2 = update.getOauth2().copy();
        }
    }

    /**
     * Clears the payload slot belonging to {@code authType}. Types without a payload are ignored.
     *
     * @param authType the type whose payload is dropped
     */
    public void clearPayload(AuthType authType) {
        if (authType == null) {
            return;
        }
        switch (authType) {
            case BASIC -> basic = null;
            case BEARER -> bearer = null;
            case API_KEY -> apiKey = null;
            case OAUTH2 -> oauth2 = null;
            default -> {
            }
        }
    }

    public AuthConfig copy() {
        return AuthConfig.builder()
                .type(type)
                .basic(basic == null ? null : basic.toBuilder().build())
                .bearer(bearer == null ? null : bearer.copy())
                .apiKey(apiKey == null ? null : apiKey.copy())
                .oauth2(oauth2 == null ? null : oauth2.copy())
                .build();
    }
}
