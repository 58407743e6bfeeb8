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
public class BearerAuth {

    private String token;

    /** Authorization header scheme, e.g. "Bearer" or "JWT". */
    private String scheme;

    private AuthPlacement placement;

    public BearerAuth copy() {
        BearerAuth copy = toBuilder().build();
        copy.setPlacement(placement == null ? null : placement.toBuilder().build());
        return copy;
    }
}
