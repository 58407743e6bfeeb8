package com.codeops.workbench.dto.request;

import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.ClientOptions;
import com.codeops.workbench.entity.enums.HttpMethod;
import lombok.Builder;

import java.util.Map;

/**
 * Draft edits to stage on a request. Null fields are untouched. In the parameter maps
 * a key mapped to null deletes that entry relative to the saved request.
 */
@Builder
public record UpdateRequestPatchRequest(
        String name,
        HttpMethod method,
        String url,
        Boolean autoSave,
        String environmentId,
        String tests,
        Map<String, UpdateParamRequest> pathParams,
        Map<String, UpdateParamRequest> queryParams,
        Map<String, UpdateParamRequest> headers,
        Map<String, UpdateParamRequest> cookieParams,
        UpdateBodyRequest body,
        AuthConfig authentication,
        ClientOptions options
) {

    public boolean isEmpty() {
        return name == null && method == null && url == null && autoSave == null
                && environmentId == null && tests == null && pathParams == null
                && queryParams == null && headers == null && cookieParams == null
                && body == null && authentication == null && options == null;
    }
}
