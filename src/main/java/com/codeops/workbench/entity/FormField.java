package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.FormFieldKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A form body entry. File fields carry the on-disk path that the execution
 * pipeline reads at send time.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormField {

    private String id;

    @Builder.Default
    private String key = "";

    @Builder.Default
    private String value = "";

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private boolean secure = false;

    @Builder.Default
    private FormFieldKind kind = FormFieldKind.TEXT;

    private String fileName;
    private String contentType;
    private String filePath;

    public FormField copy() {
        return toBuilder().build();
    }
}
