package com.codeops.workbench.dto.mapper;

import com.codeops.workbench.dto.response.EnvironmentResponse;
import com.codeops.workbench.entity.Environment;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for Environment entities to response DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface EnvironmentMapper {

    /**
     * Maps an environment to a response DTO.
     *
     * @param entity   the environment
     * @param isActive whether it is the collection's active environment
     * @return the response DTO
     */
    @Mapping(target = "isActive", source = "isActive")
    @Mapping(target = "variableCount",
            expression = "java(entity.getVariables() == null ? 0 : entity.getVariables().size())")
    EnvironmentResponse toResponse(Environment entity, boolean isActive);
}
