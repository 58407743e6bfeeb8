package com.codeops.workbench.dto.mapper;

import com.codeops.workbench.dto.response.CollectionSummaryResponse;
import com.codeops.workbench.entity.CollectionIndexEntry;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for collections index entries to summary DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface CollectionMapper {

    /**
     * Maps an index entry to a summary response DTO.
     *
     * @param entry the index entry
     * @return the summary response DTO
     */
    @Mapping(target = "requestCount", source = "count")
    @Mapping(target = "createdAt", source = "created")
    @Mapping(target = "updatedAt", source = "updated")
    CollectionSummaryResponse toSummaryResponse(CollectionIndexEntry entry);
}
