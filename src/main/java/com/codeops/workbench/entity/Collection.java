package com.codeops.workbench.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A collection: folder arena, requests, environments and the derived request index.
 * Only the collection store mutates instances; everything handed to callers is a copy.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Collection {

    private String id;
    private String name;
    private String description;
    private Instant updated;

    @Builder.Default
    private AuthConfig authentication = AuthConfig.none();

    private String activeEnvironmentId;

    @Builder.Default
    private Map<String, Environment> environments = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Folder> folders = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Request> requests = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RequestLocation> requestIndex = new LinkedHashMap<>();

    /**
     * Deep copy of the whole collection, including drafts and the request index.
     *
     * @return an independent snapshot
     */
    public Collection copy() {
        Map<String, Environment> envs = new LinkedHashMap<>();
        if (environments != null) {
            environments.forEach((k, v) -> envs.put(k, v.copy()));
        }
        Map<String, Folder> folderCopy = new LinkedHashMap<>();
        if (folders != null) {
            folders.forEach((k, v) -> folderCopy.put(k, v.copy()));
        }
        Map<String, Request> requestCopy = new LinkedHashMap<>();
        if (requests != null) {
            requests.forEach((k, v) -> requestCopy.put(k, v.copy()));
        }
        return toBuilder()
                .authentication(authentication == null ? null : authentication.copy())
                .environments(envs)
                .folders(folderCopy)
                .requests(requestCopy)
                .requestIndex(requestIndex == null ? new LinkedHashMap<>() : new LinkedHashMap<>(requestIndex))
                .build();
    }
}
