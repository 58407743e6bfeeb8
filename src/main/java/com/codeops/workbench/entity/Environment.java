package com.codeops.workbench.entity;

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
 * Named set of variables scoped to a collection.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Environment {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private Map<String, EnvironmentVariable> variables = new LinkedHashMap<>();

    public Environment copy() {
        Map<String, EnvironmentVariable> vars = new LinkedHashMap<>();
        if (variables != null) {
            variables.forEach((k, v) -> vars.put(k, v.toBuilder().build()));
        }
        return toBuilder().variables(vars).build();
    }
}
