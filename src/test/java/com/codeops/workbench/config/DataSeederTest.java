package com.codeops.workbench.config;

import com.codeops.workbench.dto.request.CreateCollectionRequest;
import com.codeops.workbench.dto.request.CreateEnvironmentRequest;
import com.codeops.workbench.dto.request.CreateFolderRequest;
import com.codeops.workbench.dto.request.CreateRequestRequest;
import com.codeops.workbench.dto.request.SaveEnvironmentVariableRequest;
import com.codeops.workbench.dto.response.CollectionSummaryResponse;
import com.codeops.workbench.dto.response.EnvironmentResponse;
import com.codeops.workbench.dto.response.FolderResponse;
import com.codeops.workbench.service.CollectionService;
import com.codeops.workbench.service.EnvironmentService;
import com.codeops.workbench.service.FolderService;
import com.codeops.workbench.service.RequestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataSeederTest {

    @Mock
    private CollectionService collectionService;

    @Mock
    private FolderService folderService;

    @Mock
    private RequestService requestService;

    @Mock
    private EnvironmentService environmentService;

    private WorkbenchProperties properties;
    private DataSeeder seeder;

    @BeforeEach
    void setUp() {
        properties = new WorkbenchProperties();
        seeder = new DataSeeder(properties, collectionService, folderService, requestService, environmentService);
    }

    @Test
    void run_seedingDisabled_doesNothing() {
        properties.setSeedSampleData(false);

        seeder.run();

        verifyNoInteractions(collectionService, folderService, requestService, environmentService);
    }

    @Test
    void run_sampleAlreadyPresent_skips() {
        when(collectionService.listCollections()).thenReturn(List.of(
                summary("c1", DataSeeder.SAMPLE_COLLECTION_NAME)));

        seeder.run();

        verify(collectionService, never()).addCollection(any());
        verifyNoInteractions(folderService, requestService, environmentService);
    }

    @Test
    void run_emptyStore_seedsThroughServices() {
        when(collectionService.listCollections()).thenReturn(List.of(summary(AppConstants.SCRATCH_COLLECTION_ID, "Scratches")));
        when(collectionService.addCollection(any(CreateCollectionRequest.class)))
                .thenReturn(summary("c1", DataSeeder.SAMPLE_COLLECTION_NAME));
        when(folderService.createFolder(eq("c1"), any(CreateFolderRequest.class)))
                .thenReturn(folder("f1"), folder("f2"), folder("f3"));
        when(environmentService.createEnvironment(eq("c1"), any(CreateEnvironmentRequest.class)))
                .thenReturn(new EnvironmentResponse("e1", "Local", null, false, 0));

        seeder.run();

        verify(folderService, times(3)).createFolder(eq("c1"), any(CreateFolderRequest.class));
        verify(requestService, times(6)).createRequest(eq("c1"), any(CreateRequestRequest.class));
        verify(environmentService, times(2)).addVariable(eq("c1"), eq("e1"), any(SaveEnvironmentVariableRequest.class));
        verify(environmentService).setActiveEnvironment("c1", "e1");
        verify(folderService).createFolder("c1", new CreateFolderRequest("f2", "Members"));
    }

    private static CollectionSummaryResponse summary(String id, String name) {
        return new CollectionSummaryResponse(id, name, 1, 0, Instant.EPOCH, Instant.EPOCH);
    }

    private static FolderResponse folder(String id) {
        return new FolderResponse(id, "c1", AppConstants.ROOT_FOLDER_ID, id, 1, List.of(), List.of());
    }
}
