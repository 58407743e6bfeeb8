package com.codeops.workbench.entity;

import com.codeops.workbench.entity.enums.BodyLanguage;
import com.codeops.workbench.entity.enums.BodyType;
import com.codeops.workbench.entity.enums.FormEncoding;
import com.fasterxml.jackson.annotation.JsonIgnore;
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
 * Request body. Every field is optional so the same shape doubles as the
 * per-field body overlay inside a {@link RequestPatch}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestBody {

    private BodyType type;
    private BodyLanguage language;
    private String content;
    private FormEncoding encoding;
    private Map<String, FormField> formData;
    private String binaryPath;
    private String binaryFileName;
    private String binaryContentType;

    public static RequestBody none() {
        return RequestBody.builder().type(BodyType.NONE).build();
    }

    /**
     * Returns whether no field is set.
     *
     * @return true if every field is null
     */
    @JsonIgnore
    public boolean isEmpty() {
        return type == null && language == null && content == null && encoding == null
                && formData == null && binaryPath == null && binaryFileName == null
                && binaryContentType == null;
    }

    public RequestBody copy() {
        RequestBody copy = toBuilder().build();
        copy.setFormData(copyFormData(formData));
        return copy;
    }

    static Map<String, FormField> copyFormData(Map<String, FormField> source) {
        if (source == null) {
            return null;
        }
        Map<String, FormField> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v == null ? null : v.copy()));
        return copy;
    }
}
