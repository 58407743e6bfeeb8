package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.HttpMethod;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * Sparse overlay of unsaved edits on a {@link Request}.
 * <p>
 * A scalar is present only while it differs from the base value. A parameter map, when
 * present, is the complete replacement map: a key missing from it is deleted relative to
 * base. {@link #authentication} and {@link #options} are full shallow copies of the edited
 * object. {@link #body} holds only the body fields that differ from base, with
 * {@code formData} again acting as a replacement map.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestPatch {

    private String name;
    private HttpMethod method;
    private String url;
    private Boolean autoSave;
    private String environmentId;
    private String tests;
    private Map<String, RequestParam> pathParams;
    private Map<String, RequestParam> queryParams;
    private Map<String, RequestParam> headers;
    private Map<String, RequestParam> cookieParams;
    private RequestBody body;
    private AuthConfig authentication;
    private ClientOptions options;

    /**
     * Returns whether this patch carries no edits.
     *
     * @return true if no field is present
     */
    @JsonIgnore
    public boolean isEmpty() {
        return name == null && method == null && url == null && autoSave == null
                && environmentId == null && tests == null && pathParams == null
                && queryParams == null && headers == null && cookieParams == null
                && body == null && authentication == null && options == null;
    }

    public RequestPatch copy() {
        return RequestPatch.builder()
                .name(name)
                .method(method)
                .url(url)
                .autoSave(autoSave)
                .environmentId(environmentId)
                .tests(tests)
                .pathParams(RequestParam.copyAll(pathParams))
                .queryParams(RequestParam.copyAll(queryParams))
                .headers(RequestParam.copyAll(headers))
                .cookieParams(RequestParam.copyAll(cookieParams))
                .body(body == null ? null : body.copy())
                .authentication(authentication == null ? null : authentication.copy())
                .options(options == null ? null : options.copy())
                .build();
    }
}
