package com.codeops.workbench.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiKeyAuth {

    private String key;
    private String value;
    private AuthPlacement placement;

    public ApiKeyAuth copy() {
        ApiKeyAuth copy = toBuilder().build();
        copy.setPlacement(placement == null ? null : placement.toBuilder().build());
        return copy;
    }
}
