package com.codeops.workbench.dto.mapper;

import com.codeops.workbench.dto.response.FolderResponse;
import com.codeops.workbench.entity.Folder;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper for Folder nodes to response DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface FolderMapper {

    /**
     * Maps a folder node to a response DTO. Id lists are copied.
     *
     * @param folder       the folder node
     * @param collectionId the owning collection
     * @return the response DTO
     */
    FolderResponse toResponse(Folder folder, String collectionId);
}
