package com.codeops.workbench.entity;

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
 * A single keyed entry of a request's path, query, header or cookie parameter map.
 * The map key is always equal to {@link #id}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestParam {

    private String id;

    @Builder.Default
    private String name = "";

    @Builder.Default
    private String value = "";

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private boolean secure = false;

    public RequestParam copy() {
        return toBuilder().build();
    }

    /**
     * Copies a parameter map entry by entry, keeping iteration order.
     *
     * @param source the map to copy, may be null
     * @return an independent ordered copy, or null when {@code source} is null
     */
    public static Map<String, RequestParam> copyAll(Map<String, RequestParam> source) {
        if (source == null) {
            return null;
        }
        Map<String, RequestParam> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v == null ? null : v.copy()));
        return copy;
    }
}
