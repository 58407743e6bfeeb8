package com.codeops.workbench.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Folder node of a collection's tree. Nodes reference each other by id only;
 * {@link #childFolderIds} is the authoritative ordered child listing.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Folder {

    private String id;
    private String name;

    /** Null only for the root folder. */
    private String parentId;

    @Builder.Default
    private int order = 1;

    @Builder.Default
    private List<String> childFolderIds = new ArrayList<>();

    @Builder.Default
    private List<String> requestIds = new ArrayList<>();

    public Folder copy() {
        return toBuilder()
                .childFolderIds(childFolderIds == null ? null : new ArrayList<>(childFolderIds))
                .requestIds(requestIds == null ? null : new ArrayList<>(requestIds))
                .build();
    }
}
