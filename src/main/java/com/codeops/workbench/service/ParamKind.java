package com.codeops.workbench.service;

import com.codeops.workbench.dto.request.UpdateParamRequest;
import com.codeops.workbench.dto.request.UpdateRequestPatchRequest;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.RequestParam;
import com.codeops.workbench.entity.RequestPatch;

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The four keyed parameter maps of a request, with accessors for the saved map,
 * the draft map and the matching field of a draft update.
 */
public enum ParamKind {

    PATH(Request::getPathParams, Request::setPathParams,
            RequestPatch::getPathParams, RequestPatch::setPathParams,
            UpdateRequestPatchRequest::pathParams),
    QUERY(Request::getQueryParams, Request::setQueryParams,
            RequestPatch::getQueryParams, RequestPatch::setQueryParams,
            UpdateRequestPatchRequest::queryParams),
    HEADER(Request::getHeaders, Request::setHeaders,
            RequestPatch::getHeaders, RequestPatch::setHeaders,
            UpdateRequestPatchRequest::headers),
    COOKIE(Request::getCookieParams, Request::setCookieParams,
            RequestPatch::getCookieParams, RequestPatch::setCookieParams,
            UpdateRequestPatchRequest::cookieParams);

    private final Function<Request, Map<String, RequestParam>> baseGetter;
    private final BiConsumer<Request, Map<String, RequestParam>> baseSetter;
    private final Function<RequestPatch, Map<String, RequestParam>> draftGetter;
    private final BiConsumer<RequestPatch, Map<String, RequestParam>> draftSetter;
    private final Function<UpdateRequestPatchRequest, Map<String, UpdateParamRequest>> updateGetter;

    ParamKind(Function<Request, Map<String, RequestParam>> baseGetter,
              BiConsumer<Request, Map<String, RequestParam>> baseSetter,
              Function<RequestPatch, Map<String, RequestParam>> draftGetter,
              BiConsumer<RequestPatch, Map<String, RequestParam>> draftSetter,
              Function<UpdateRequestPatchRequest, Map<String, UpdateParamRequest>> updateGetter) {
        this.baseGetter = baseGetter;
        this.baseSetter = baseSetter;
        this.draftGetter = draftGetter;
        this.draftSetter = draftSetter;
        this.updateGetter = updateGetter;
    }

    Map<String, RequestParam> base(Request request) {
        return baseGetter.apply(request);
    }

    void setBase(Request request, Map<String, RequestParam> params) {
        baseSetter.accept(request, params);
    }

    Map<String, RequestParam> draft(RequestPatch patch) {
        return draftGetter.apply(patch);
    }

    void setDraft(RequestPatch patch, Map<String, RequestParam> params) {
        draftSetter.accept(patch, params);
    }

    Map<String, UpdateParamRequest> updates(UpdateRequestPatchRequest update) {
        return updateGetter.apply(update);
    }

    /**
     * Wraps a parameter map into a draft update that touches only this kind.
     *
     * @param params entries to upsert, null values delete
     * @return the draft update
     */
    public UpdateRequestPatchRequest toUpdate(Map<String, UpdateParamRequest> params) {
        UpdateRequestPatchRequest.UpdateRequestPatchRequestBuilder builder = UpdateRequestPatchRequest.builder();
        return switch (this) {
            case PATH -> builder.pathParams(params).build();
            case QUERY -> builder.queryParams(params).build();
            case HEADER -> builder.headers(params).build();
            case COOKIE -> builder.cookieParams(params).build();
        };
    }
}
