package com.codeops.workbench.entity;

import com.codeops.workbench.config.AppConstants;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A saved HTTP request. Base fields hold the last committed state; unsaved edits
 * live in {@link #patch} until committed or discarded.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Request {

    private String id;
    private String collectionId;

    @Builder.Default
    private String folderId = AppConstants.ROOT_FOLDER_ID;

    /** 1-based position among the requests of {@link #folderId}. */
    private Integer order;

    private String name;

    @Builder.Default
    private HttpMethod method = HttpMethod.GET;

    @Builder.Default
    private String url = "";

    @Builder.Default
    private boolean autoSave = false;

    private String environmentId;

    @Builder.Default
    private Map<String, RequestParam> pathParams = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RequestParam> queryParams = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RequestParam> headers = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RequestParam> cookieParams = new LinkedHashMap<>();

    @Builder.Default
    private RequestBody body = RequestBody.none();

    @Builder.Default
    private AuthConfig authentication = AuthConfig.inherit();

    private String tests;

    @Builder.Default
    private ClientOptions options = new ClientOptions();

    @Builder.Default
    private RequestPatch patch = new RequestPatch();

    /** Change counter; bumped by every commit or discard. */
    private long updated;

    /**
     * Deep copy, including the patch.
     *
     * @return an independent copy of this request
     */
    public Request copy() {
        return toBuilder()
                .pathParams(RequestParam.copyAll(pathParams))
                .queryParams(RequestParam.copyAll(queryParams))
                .headers(RequestParam.copyAll(headers))
                .cookieParams(RequestParam.copyAll(cookieParams))
                .body(body == null ? null : body.copy())
                .authentication(authentication == null ? null : authentication.copy())
                .options(options == null ? null : options.copy())
                .patch(patch == null ? null : patch.copy())
                .build();
    }
}
