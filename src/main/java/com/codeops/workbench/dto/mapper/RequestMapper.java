package com.codeops.workbench.dto.mapper;

import com.codeops.workbench.dto.response.RequestSummaryResponse;
import com.codeops.workbench.entity.Request;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper for Request entities to summary DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface RequestMapper {

    /**
     * Maps a request, usually its effective view, to a summary.
     *
     * @param request the request
     * @param dirty   whether the request has unsaved edits
     * @return the summary DTO
     */
    RequestSummaryResponse toSummaryResponse(Request request, boolean dirty);
}
