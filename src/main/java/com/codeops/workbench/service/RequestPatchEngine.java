package com.codeops.workbench.service;

import com.codeops.workbench.dto.request.UpdateBodyRequest;
import com.codeops.workbench.dto.request.UpdateFormFieldRequest;
import com.codeops.workbench.dto.request.UpdateParamRequest;
import com.codeops.workbench.dto.request.UpdateRequestPatchRequest;
import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.ClientOptions;
import com.codeops.workbench.entity.FormField;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.RequestBody;
import com.codeops.workbench.entity.RequestParam;
import com.codeops.workbench.entity.RequestPatch;
import com.codeops.workbench.entity.enums.AuthType;
import com.codeops.workbench.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Stages, commits and discards draft edits on a single request.
 * <p>
 * The draft ({@link RequestPatch}) only ever holds what differs from the saved request:
 * every edit is pruned back out as soon as it matches the saved value again, so an empty
 * draft always means "no unsaved changes". Parameter and form maps are staged as whole
 * replacement maps, which is how deletions survive a commit.
 * <p>
 * Instances are stateless; callers pass live requests while holding the store lock.
 */
@Component
@Slf4j
public class RequestPatchEngine {

    /**
     * Stages a multi-field edit.
     *
     * @param request the live request
     * @param update  the fields to edit
     * @throws ValidationException if {@code update} carries no field
     */
    public void applyPatch(Request request, UpdateRequestPatchRequest update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("Draft update for request " + request.getId()
                    + " is empty; discard the draft instead");
        }
        RequestPatch patch = request.getPatch() == null ? new RequestPatch() : request.getPatch();

        stageScalar(update.name(), request.getName(), patch::setName);
        stageScalar(update.method(), request.getMethod(), patch::setMethod);
        stageScalar(update.url(), request.getUrl(), patch::setUrl);
        stageScalar(update.autoSave(), request.isAutoSave(), patch::setAutoSave);
        stageScalar(update.environmentId(), request.getEnvironmentId(), patch::setEnvironmentId);
        stageScalar(update.tests(), request.getTests(), patch::setTests);

        for (ParamKind kind : ParamKind.values()) {
            Map<String, UpdateParamRequest> updates = kind.updates(update);
            if (updates != null) {
                stageParams(kind, request, patch, updates);
            }
        }
        if (update.body() != null) {
            stageBody(request, patch, update.body());
        }
        if (update.authentication() != null) {
            stageAuthentication(request, patch, update.authentication());
        }
        if (update.options() != null) {
            stageOptions(request, patch, update.options());
        }

        request.setPatch(patch.isEmpty() ? new RequestPatch() : patch);
        request.setUpdated(request.getUpdated() + 1);
        log.debug("Staged draft edit on request {}, dirty={}", request.getId(), isDirty(request));
    }

    /**
     * Stages an upsert or delete of one entry in a parameter map.
     *
     * @param request the live request
     * @param kind    which parameter map
     * @param paramId the entry id
     * @param update  the fields to change, or null to delete the entry
     */
    public void updateParam(Request request, ParamKind kind, String paramId, UpdateParamRequest update) {
        Map<String, UpdateParamRequest> entry = new LinkedHashMap<>();
        entry.put(paramId, update);
        applyPatch(request, kind.toUpdate(entry));
    }

    /**
     * Stages an upsert or delete of one form body field.
     *
     * @param request the live request
     * @param fieldId the field id
     * @param update  the fields to change, or null to delete the field
     */
    public void updateFormField(Request request, String fieldId, UpdateFormFieldRequest update) {
        Map<String, UpdateFormFieldRequest> entry = new LinkedHashMap<>();
        entry.put(fieldId, update);
        applyPatch(request, UpdateRequestPatchRequest.builder()
                .body(UpdateBodyRequest.builder().formData(entry).build())
                .build());
    }

    public void updateBody(Request request, UpdateBodyRequest update) {
        applyPatch(request, UpdateRequestPatchRequest.builder().body(update).build());
    }

    /**
     * Writes the draft into the saved fields and clears it.
     *
     * @param request the live request
     * @return false if there was nothing to commit, in which case the request is untouched
     */
    public boolean commit(Request request) {
        RequestPatch patch = request.getPatch();
        if (patch == null || patch.isEmpty()) {
            request.setPatch(new RequestPatch());
            return false;
        }
        applyPatchFields(request, patch);
        request.setPatch(new RequestPatch());
        request.setUpdated(request.getUpdated() + 1);
        return true;
    }

    public void discard(Request request) {
        request.setPatch(new RequestPatch());
        request.setUpdated(request.getUpdated() + 1);
    }

    /**
     * Computes the request as it would look after a commit, without changing it.
     *
     * @param request the request, left unchanged
     * @return a detached copy with the draft applied and an empty draft
     */
    public Request effectiveView(Request request) {
        Request view = request.copy();
        RequestPatch patch = view.getPatch();
        if (patch != null && !patch.isEmpty()) {
            applyPatchFields(view, patch);
        }
        view.setPatch(new RequestPatch());
        return view;
    }

    public boolean isDirty(Request request) {
        return request.getPatch() != null && !request.getPatch().isEmpty();
    }

    /**
     * Merges {@code patch} onto the saved fields of {@code target}. Maps present in the
     * patch replace the saved ones wholesale; switching the authentication type drops the
     * payload of the previous type.
     */
    private void applyPatchFields(Request target, RequestPatch patch) {
        if (patch.getName() != null) {
            target.setName(patch.getName());
        }
        if (patch.getMethod() != null) {
            target.setMethod(patch.getMethod());
        }
        if (patch.getUrl() != null) {
            target.setUrl(patch.getUrl());
        }
        if (patch.getAutoSave() != null) {
            target.setAutoSave(patch.getAutoSave());
        }
        if (patch.getEnvironmentId() != null) {
            target.setEnvironmentId(patch.getEnvironmentId());
        }
        if (patch.getTests() != null) {
            target.setTests(patch.getTests());
        }
        for (ParamKind kind : ParamKind.values()) {
            Map<String, RequestParam> draft = kind.draft(patch);
            if (draft != null) {
                kind.setBase(target, RequestParam.copyAll(draft));
            }
        }
        if (patch.getBody() != null) {
            target.setBody(mergeBody(target.getBody(), patch.getBody()));
        }
        if (patch.getAuthentication() != null) {
            target.setAuthentication(mergeAuthentication(target.getAuthentication(), patch.getAuthentication()));
        }
        if (patch.getOptions() != null) {
            ClientOptions merged = target.getOptions() == null ? new ClientOptions() : target.getOptions().copy();
            merged.mergeFrom(patch.getOptions());
            target.setOptions(merged);
        }
    }

    private static RequestBody mergeBody(RequestBody base, RequestBody draft) {
        RequestBody merged = base == null ? new RequestBody() : base.copy();
        if (draft.getType() != null) {
            merged.setType(draft.getType());
        }
        if (draft.getLanguage() != null) {
            merged.setLanguage(draft.getLanguage());
        }
        if (draft.getContent() != null) {
            merged.setContent(draft.getContent());
        }
        if (draft.getEncoding() != null) {
            merged.setEncoding(draft.getEncoding());
        }
        if (draft.getFormData() != null) {
            merged.setFormData(draft.copy().getFormData());
        }
        if (draft.getBinaryPath() != null) {
            merged.setBinaryPath(draft.getBinaryPath());
        }
        if (draft.getBinaryFileName() != null) {
            merged.setBinaryFileName(draft.getBinaryFileName());
        }
        if (draft.getBinaryContentType() != null) {
            merged.setBinaryContentType(draft.getBinaryContentType());
        }
        return merged;
    }

    private static AuthConfig mergeAuthentication(AuthConfig base, AuthConfig draft) {
        AuthConfig merged = base == null ? AuthConfig.inherit() : base.copy();
        AuthType previous = merged.getType();
        merged.mergeFrom(draft);
        if (draft.getType() != null && draft.getType() != previous && previous != null && previous.hasPayload()) {
            merged.clearPayload(previous);
        }
        return merged;
    }

    private static <T> void stageScalar(T value, T base, Consumer<T> setter) {
        if (value == null) {
            return;
        }
        setter.accept(Objects.equals(value, base) ? null : value);
    }

    private void stageParams(ParamKind kind, Request request, RequestPatch patch,
                             Map<String, UpdateParamRequest> updates) {
        Map<String, RequestParam> base = kind.base(request) == null ? new LinkedHashMap<>() : kind.base(request);
        Map<String, RequestParam> working = kind.draft(patch) != null
                ? new LinkedHashMap<>(kind.draft(patch))
                : RequestParam.copyAll(base);
        updates.forEach((id, change) -> {
            if (change == null) {
                working.remove(id);
                return;
            }
            RequestParam current = working.containsKey(id) ? working.get(id) : base.get(id);
            RequestParam next = current == null ? RequestParam.builder().id(id).build() : current.copy();
            next.setId(id);
            if (change.name() != null) {
                next.setName(change.name());
            }
            if (change.value() != null) {
                next.setValue(change.value());
            }
            if (change.enabled() != null) {
                next.setEnabled(change.enabled());
            }
            if (change.secure() != null) {
                next.setSecure(change.secure());
            }
            working.put(id, next);
        });
        kind.setDraft(patch, working.equals(base) ? null : working);
    }

    private void stageBody(Request request, RequestPatch patch, UpdateBodyRequest update) {
        RequestBody base = request.getBody() == null ? new RequestBody() : request.getBody();
        RequestBody draft = patch.getBody() == null ? new RequestBody() : patch.getBody();

        stageScalar(update.type(), base.getType(), draft::setType);
        stageScalar(update.language(), base.getLanguage(), draft::setLanguage);
        stageScalar(update.content(), base.getContent(), draft::setContent);
        stageScalar(update.encoding(), base.getEncoding(), draft::setEncoding);
        stageScalar(update.binaryPath(), base.getBinaryPath(), draft::setBinaryPath);
        stageScalar(update.binaryFileName(), base.getBinaryFileName(), draft::setBinaryFileName);
        stageScalar(update.binaryContentType(), base.getBinaryContentType(), draft::setBinaryContentType);

        if (update.formData() != null) {
            Map<String, FormField> baseForm = base.getFormData() == null ? new LinkedHashMap<>() : base.getFormData();
            Map<String, FormField> working = draft.getFormData() != null
                    ? new LinkedHashMap<>(draft.getFormData())
                    : RequestBody.builder().formData(baseForm).build().copy().getFormData();
            update.formData().forEach((id, change) -> {
                if (change == null) {
                    working.remove(id);
                    return;
                }
                FormField current = working.containsKey(id) ? working.get(id) : baseForm.get(id);
                FormField next = current == null ? FormField.builder().id(id).build() : current.copy();
                applyFormFieldChange(next, id, change);
                working.put(id, next);
            });
            draft.setFormData(working.equals(baseForm) ? null : working);
        }
        patch.setBody(draft.isEmpty() ? null : draft);
    }

    private static void applyFormFieldChange(FormField field, String id, UpdateFormFieldRequest change) {
        field.setId(id);
        if (change.key() != null) {
            field.setKey(change.key());
        }
        if (change.value() != null) {
            field.setValue(change.value());
        }
        if (change.enabled() != null) {
            field.setEnabled(change.enabled());
        }
        if (change.secure() != null) {
            field.setSecure(change.secure());
        }
        if (change.kind() != null) {
            field.setKind(change.kind());
        }
        if (change.fileName() != null) {
            field.setFileName(change.fileName());
        }
        if (change.contentType() != null) {
            field.setContentType(change.contentType());
        }
        if (change.filePath() != null) {
            field.setFilePath(change.filePath());
        }
    }

    private void stageAuthentication(Request request, RequestPatch patch, AuthConfig update) {
        AuthConfig base = request.getAuthentication() == null ? AuthConfig.inherit() : request.getAuthentication();
        AuthConfig working = patch.getAuthentication() == null ? base.copy() : patch.getAuthentication();
        working.mergeFrom(update);
        patch.setAuthentication(activePart(working).equals(activePart(base)) ? null : working);
    }

    /** Type plus the payload of that type only; payloads of other types do not take effect. */
    private static AuthConfig activePart(AuthConfig auth) {
        AuthConfig active = AuthConfig.builder().type(auth.getType()).build();
        if (auth.getType() == null) {
            return active;
        }
        switch (auth.getType()) {
            case BASIC -> active.setBasic(auth.getBasic());
            case BEARER -> active.setBearer(auth.getBearer());
            case API_KEY -> active.setApiKey(auth.getApiKey());
            case OAUTH2 -> active.setOauth2(auth.getOauth2());
            default -> {
            }
        }
        return active;
    }

    private void stageOptions(Request request, RequestPatch patch, ClientOptions update) {
        ClientOptions base = request.getOptions() == null ? new ClientOptions() : request.getOptions();
        ClientOptions working = patch.getOptions() == null ? base.copy() : patch.getOptions();
        working.mergeFrom(update);
        patch.setOptions(working.equals(base) ? null : working);
    }
}
