package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.HttpVersionPreference;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-request HTTP client settings. Unset fields fall back to the client defaults.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientOptions {

    private Boolean disableSsl;
    private String caPath;
    private String hostOverride;
    private String ipOverride;
    private Integer timeoutSecs;
    private String userAgent;
    private HttpVersionPreference httpVersion;
    private Integer maxRedirects;

    /**
     * Shallow-merges every non-null field of {@code update} onto this object.
     *
     * @param update the partial options to merge in
     */
    public void mergeFrom(ClientOptions update) {
        if (update.getDisableSsl() != null) {
            disableSsl = update.getDisableSsl();
        }
        if (update.getCaPath() != null) {
            caPath = update.getCaPath();
        }
        if (update.getHostOverride() != null) {
            hostOverride = update.getHostOverride();
        }
        if (update.getIpOverride() != null) {
            ipOverride = update.getIpOverride();
        }
        if (update.getTimeoutSecs() != null) {
            timeoutSecs = update.getTimeoutSecs();
        }
        if (update.getUserAgent() != null) {
            userAgent = update.getUserAgent();
        }
        if (update.getHttpVersion() != null) {
            httpVersion = update.getHttpVersion();
        }
        if (update.getMaxRedirects() != null) {
            maxRedirects = update.getMaxRedirects();
        }
    }

    public ClientOptions copy() {
        return toBuilder().build();
    }
}
