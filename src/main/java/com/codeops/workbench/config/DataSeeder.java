package com.codeops.workbench.config;

import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.request.CreateEnvironmentRequest;
import com.codeops.workbench.dto.request.CreateFolderRequest;
import com.codeops.workbench.dto.request.CreateRequestRequest;
import com.codeops.workbench.dto.request.SaveEnvironmentVariableRequest;
import com.codeops.workbench.entity.enums.HttpMethod;
import com.codeops.workbench.service.CollectionService;
import com.codeops.workbench.service.EnvironmentService;
import com.codeops.workbench.service.FolderService;
import com.codeops.workbench.service.RequestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Seeds a sample collection with folders, requests and an environment for development.
 * Only runs in the {@code dev} profile and is idempotent: skips if the sample collection exists.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    static final String SAMPLE_COLLECTION_NAME = "CodeOps Sample API";

    private final WorkbenchProperties properties;
    private final CollectionService collectionService;
    private final FolderService folderService;
    private final RequestService requestService;
    private final EnvironmentService environmentService;

    /**
     * Seeds development data on application startup.
     *
     * @param args command-line arguments (unused)
     */
    @Override
    public void run(String... args) {
        if (!properties.isSeedSampleData()) {
            return;
        }
        boolean exists = collectionService.listCollections().stream()
                .anyMatch(c -> SAMPLE_COLLECTION_NAME.equals(c.name()));
        if (exists) {
            log.info("DataSeeder: sample collection already exists, skipping.");
            return;
        }

        String collectionId = collectionService.addCollection(
                new CreateCollectionRequest(SAMPLE_COLLECTION_NAME, "Sample requests against a local CodeOps server")).id();

        String auth = folderService.createFolder(collectionId, new CreateFolderRequest(null, "Authentication")).id();
        seedRequest(collectionId, auth, "Login", HttpMethod.POST, "{{baseUrl}}/api/v1/auth/login");
        seedRequest(collectionId, auth, "Refresh Token", HttpMethod.POST, "{{baseUrl}}/api/v1/auth/refresh");

        String teams = folderService.createFolder(collectionId, new CreateFolderRequest(null, "Teams")).id();
        seedRequest(collectionId, teams, "List Teams", HttpMethod.GET, "{{baseUrl}}/api/v1/teams");
        seedRequest(collectionId, teams, "Get Team", HttpMethod.GET, "{{baseUrl}}/api/v1/teams/{{teamId}}");

        String members = folderService.createFolder(collectionId, new CreateFolderRequest(teams, "Members")).id();
        seedRequest(collectionId, members, "List Members", HttpMethod.GET, "{{baseUrl}}/api/v1/teams/{{teamId}}/members");

        seedRequest(collectionId, null, "Health", HttpMethod.GET, "{{baseUrl}}/health");

        String local = environmentService.createEnvironment(collectionId,
                new CreateEnvironmentRequest("Local", "Local development server")).id();
        environmentService.addVariable(collectionId, local,
                new SaveEnvironmentVariableRequest("baseUrl", "http://localhost:8080", false));
        environmentService.addVariable(collectionId, local,
                new SaveEnvironmentVariableRequest("teamId", "", false));
        environmentService.setActiveEnvironment(collectionId, local);

        log.info("DataSeeder: seeded sample collection {} with 3 folders, 6 requests, 1 environment", collectionId);
    }

    private void seedRequest(String collectionId, String folderId, String name, HttpMethod method, String url) {
        requestService.createRequest(collectionId, new CreateRequestRequest(folderId, name, method, url, null));
    }
}
