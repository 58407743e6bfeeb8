package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.OAuth2GrantType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth2 client settings. Token acquisition happens in the execution pipeline;
 * this object only stores what the user configured.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuth2Auth {

    @Builder.Default
    private OAuth2GrantType grantType = OAuth2GrantType.CLIENT_CREDENTIALS;

    private String discoveryUrl;
    private String authUrl;
    private String tokenUrl;
    private String clientId;
    private String clientSecret;
    private String scope;
    private String username;
    private String password;
    private String refreshToken;

    /** "always" or "never". */
    private String tokenCaching;

    /** "basic" or "body". */
    private String clientAuth;

    private Map<String, String> tokenExtraParams;

    public OAuth2Auth copy() {
        OAuth2Auth copy = toBuilder().build();
        copy.setTokenExtraParams(tokenExtraParams == null ? null : new LinkedHashMap<>(tokenExtraParams));
        return copy;
    }
}
