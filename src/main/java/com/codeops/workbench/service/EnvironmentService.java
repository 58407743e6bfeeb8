package com.codeops.workbench.service;

import com.codeops.workbench.dto.mapper.EnvironmentMapper;
import com.codeops.workbench.dto.request.CreateEnvironmentRequest;
import com.codeops.workbench.dto.request.SaveEnvironmentVariableRequest;
import com.codeops.workbench.dto.request.UpdateEnvironmentRequest;
import com.codeops.workbench.dto.response.EnvironmentResponse;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Environment;
import com.codeops.workbench.entity.EnvironmentVariable;
import com.codeops.workbench.exception.NotFoundException;
import com.codeops.workbench.exception.ValidationException;
import com.codeops.workbench.store.CollectionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Service for the environments of a collection and their variables. A collection has
 * at most one active environment; deleting it leaves none active.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Validated
public class EnvironmentService {

    private final CollectionStore collectionStore;
    private final IdGenerator idGenerator;
    private final EnvironmentMapper environmentMapper;

    /**
     * Creates an environment in a collection.
     *
     * @param collectionId the collection
     * @param request      name and description
     * @return the created environment
     * @throws ValidationException if the collection already has an environment with that name
     * @throws NotFoundException   if the collection does not exist
     */
    public EnvironmentResponse createEnvironment(String collectionId, @Valid CreateEnvironmentRequest request) {
        String name = FolderService.requireName(request.name());
        EnvironmentResponse response = collectionStore.mutate(collectionId, collection -> {
            rejectDuplicateName(collection, name, null);
            Environment environment = Environment.builder()
                    .id(idGenerator.newId())
                    .name(name)
                    .description(request.description())
                    .build();
            collection.getEnvironments().put(environment.getId(), environment);
            return toResponse(collection, environment);
        });
        log.info("Created environment '{}' in collection {}", name, collectionId);
        return response;
    }

    public List<EnvironmentResponse> getEnvironments(String collectionId) {
        return collectionStore.read(collectionId, collection -> collection.getEnvironments().values().stream()
                .map(environment -> toResponse(collection, environment))
                .toList());
    }

    /**
     * Updates name or description of an environment; null fields are left unchanged.
     *
     * @param collectionId  the collection
     * @param environmentId the environment
     * @param request       the fields to change
     * @return the updated environment
     * @throws NotFoundException   if the collection or environment does not exist
     * @throws ValidationException if renaming would duplicate another environment's name
     */
    public EnvironmentResponse updateEnvironment(String collectionId, String environmentId,
                                                 @Valid UpdateEnvironmentRequest request) {
        String name = request.name() == null ? null : FolderService.requireName(request.name());
        EnvironmentResponse response = collectionStore.mutate(collectionId, collection -> {
            Environment environment = requireEnvironment(collection, environmentId);
            if (name != null) {
                rejectDuplicateName(collection, name, environmentId);
                environment.setName(name);
            }
            if (request.description() != null) {
                environment.setDescription(request.description());
            }
            return toResponse(collection, environment);
        });
        log.info("Updated environment {} in collection {}", environmentId, collectionId);
        return response;
    }

    /**
     * Deletes an environment, clearing the active selection if it pointed at it.
     *
     * @param collectionId  the collection
     * @param environmentId the environment
     * @throws NotFoundException if the collection or environment does not exist
     */
    public void deleteEnvironment(String collectionId, String environmentId) {
        collectionStore.update(collectionId, collection -> {
            requireEnvironment(collection, environmentId);
            collection.getEnvironments().remove(environmentId);
            if (environmentId.equals(collection.getActiveEnvironmentId())) {
                collection.setActiveEnvironmentId(null);
            }
        });
        log.info("Deleted environment {} from collection {}", environmentId, collectionId);
    }

    /**
     * Selects the active environment of a collection.
     *
     * @param collectionId  the collection
     * @param environmentId the environment, or null to deactivate all
     * @throws NotFoundException if the collection or environment does not exist
     */
    public void setActiveEnvironment(String collectionId, String environmentId) {
        collectionStore.update(collectionId, collection -> {
            if (environmentId != null) {
                requireEnvironment(collection, environmentId);
            }
            collection.setActiveEnvironmentId(environmentId);
        });
        log.info("Set active environment of collection {} to {}", collectionId, environmentId);
    }

    public EnvironmentVariable addVariable(String collectionId, String environmentId,
                                           @Valid SaveEnvironmentVariableRequest request) {
        String name = FolderService.requireName(request.name());
        EnvironmentVariable added = collectionStore.mutate(collectionId, collection -> {
            Environment environment = requireEnvironment(collection, environmentId);
            EnvironmentVariable variable = EnvironmentVariable.builder()
                    .id(idGenerator.newId())
                    .name(name)
                    .value(request.value() == null ? "" : request.value())
                    .secure(Boolean.TRUE.equals(request.secure()))
                    .build();
            environment.getVariables().put(variable.getId(), variable);
            return variable.toBuilder().build();
        });
        log.debug("Added variable '{}' to environment {}", name, environmentId);
        return added;
    }

    /**
     * Replaces name and value of a variable; a null {@code secure} keeps the current flag.
     *
     * @throws NotFoundException if the collection, environment or variable does not exist
     */
    public EnvironmentVariable updateVariable(String collectionId, String environmentId, String variableId,
                                              @Valid SaveEnvironmentVariableRequest request) {
        String name = FolderService.requireName(request.name());
        EnvironmentVariable updated = collectionStore.mutate(collectionId, collection -> {
            EnvironmentVariable variable = requireVariable(requireEnvironment(collection, environmentId), variableId);
            variable.setName(name);
            variable.setValue(request.value() == null ? "" : request.value());
            if (request.secure() != null) {
                variable.setSecure(request.secure());
            }
            return variable.toBuilder().build();
        });
        log.debug("Updated variable {} of environment {}", variableId, environmentId);
        return updated;
    }

    public void deleteVariable(String collectionId, String environmentId, String variableId) {
        collectionStore.update(collectionId, collection -> {
            Environment environment = requireEnvironment(collection, environmentId);
            requireVariable(environment, variableId);
            environment.getVariables().remove(variableId);
        });
        log.debug("Deleted variable {} from environment {}", variableId, environmentId);
    }

    private EnvironmentResponse toResponse(Collection collection, Environment environment) {
        return environmentMapper.toResponse(environment, environment.getId().equals(collection.getActiveEnvironmentId()));
    }

    private static Environment requireEnvironment(Collection collection, String environmentId) {
        Environment environment = environmentId == null ? null : collection.getEnvironments().get(environmentId);
        if (environment == null) {
            throw new NotFoundException("Environment not found: " + environmentId);
        }
        return environment;
    }

    private static EnvironmentVariable requireVariable(Environment environment, String variableId) {
        EnvironmentVariable variable = variableId == null ? null : environment.getVariables().get(variableId);
        if (variable == null) {
            throw new NotFoundException("Variable not found: " + variableId);
        }
        return variable;
    }

    private static void rejectDuplicateName(Collection collection, String name, String exceptId) {
        boolean taken = collection.getEnvironments().values().stream()
                .anyMatch(e -> name.equals(e.getName()) && !e.getId().equals(exceptId));
        if (taken) {
            throw new ValidationException("Environment with name '" + name + "' already exists in this collection");
        }
    }
}
