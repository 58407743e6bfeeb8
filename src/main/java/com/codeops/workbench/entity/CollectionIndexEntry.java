package com.codeops.workbench.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Entry of the collections index: enough to list collections without loading them.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionIndexEntry {

    private String id;
    private int order;
    private String name;

    /** Number of requests in the collection. */
    private int count;

    private Instant created;
    private Instant updated;

    public CollectionIndexEntry copy() {
        return toBuilder().build();
    }
}
