package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.AuthPlacementType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Injection point of a credential. {@code name} applies to header, query and cookie
 * placements; {@code fieldName} and {@code contentType} apply to body placement.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthPlacement {

    private AuthPlacementType type;
    private String name;
    private String fieldName;
    private String contentType;

    public static AuthPlacement header() {
        return AuthPlacement.builder().type(AuthPlacementType.HEADER).name("Authorization").build();
    }
}
